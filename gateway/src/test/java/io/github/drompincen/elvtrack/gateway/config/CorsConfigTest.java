package io.github.drompincen.elvtrack.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.cors.CorsConfiguration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorsConfigTest {

    @Test
    void defaultAdmitsAnyOrigin() {
        CorsConfiguration config = new CorsConfig(List.of("*")).corsConfigurationSource()
                .getCorsConfiguration(new MockHttpServletRequest("POST", "/api/sync"));

        assertThat(config).isNotNull();
        assertThat(config.checkOrigin("https://yard.example.org")).isEqualTo("https://yard.example.org");
        assertThat(config.getAllowCredentials()).isTrue();
    }

    @Test
    void restrictedOriginsRejectOthers() {
        CorsConfiguration config = new CorsConfig(List.of("https://*.elv.et")).corsConfigurationSource()
                .getCorsConfiguration(new MockHttpServletRequest("GET", "/api/vehicles"));

        assertThat(config.checkOrigin("https://field.elv.et")).isEqualTo("https://field.elv.et");
        assertThat(config.checkOrigin("https://evil.example.com")).isNull();
    }
}
