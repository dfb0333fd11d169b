package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.protocol.api.VehicleStatus;
import io.github.drompincen.elvtrack.runtime.record.VehicleService;
import io.github.drompincen.elvtrack.runtime.validation.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VehicleControllerTest {

    @Mock private VehicleService vehicleService;

    private VehicleController controller;

    @BeforeEach
    void setUp() {
        controller = new VehicleController(vehicleService);
    }

    @Test
    void createReturnsStoredDocument() {
        Map<String, Object> stored = Map.of("id", "65f0c0ffee0000000000abcd", "vin", "X1", "status", "unknown");
        when(vehicleService.create(anyMap())).thenReturn(stored);

        ResponseEntity<Map<String, Object>> response = controller.create(Map.of("vin", "X1"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(stored);
    }

    @Test
    void listParsesStatusWireValue() {
        when(vehicleService.list(VehicleStatus.DISMANTLED, 10)).thenReturn(List.of(Map.of("id", "v1")));

        assertThat(controller.list("dismantled", 10)).hasSize(1);
    }

    @Test
    void listWithoutStatusPassesNull() {
        when(vehicleService.list(null, null)).thenReturn(List.of());

        assertThat(controller.list(null, null)).isEmpty();
        verify(vehicleService).list(null, null);
    }

    @Test
    void listRejectsUnknownStatusBeforeQuerying() {
        assertThatThrownBy(() -> controller.list("crushed", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("status")
                .hasMessageContaining("crushed");
        verifyNoInteractions(vehicleService);
    }

    @Test
    void historyDelegates() {
        when(vehicleService.history("v1")).thenReturn(List.of(Map.of("id", "e1")));

        assertThat(controller.history("v1")).extracting(e -> e.get("id")).containsExactly("e1");
    }
}
