package io.github.drompincen.elvtrack.runtime.validation;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VehicleValidatorTest {

    private final VehicleValidator validator = new VehicleValidator();

    @Test
    void absentLiteralFieldsDefaultToUnknown() {
        Map<String, Object> doc = validator.normalize(Map.of("vin", "WBA123"));

        assertThat(doc).containsEntry("vin", "WBA123")
                .containsEntry("engine_condition", "unknown")
                .containsEntry("body_condition", "unknown")
                .containsEntry("damage_level", "unknown")
                .containsEntry("status", "unknown");
    }

    @Test
    void nullIsTreatedAsAbsent() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("status", null);
        raw.put("make", null);

        Map<String, Object> doc = validator.normalize(raw);

        assertThat(doc).containsEntry("status", "unknown").doesNotContainKey("make");
    }

    @Test
    void outOfEnumValueIsRejectedNotCoerced() {
        assertThatThrownBy(() -> validator.normalize(Map.of("status", "crushed")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    ValidationException ve = (ValidationException) e;
                    assertThat(ve.getField()).isEqualTo("status");
                    assertThat(ve.getConstraint()).contains("imported").contains("crushed");
                });
    }

    @Test
    void conditionLevelsAreChecked() {
        assertThatThrownBy(() -> validator.normalize(Map.of("engine_condition", "excellent")))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("engine_condition:");
        assertThatThrownBy(() -> validator.normalize(Map.of("damage_level", "total")))
                .hasMessageStartingWith("damage_level:");
    }

    @Test
    void unknownFieldsAreDropped() {
        Map<String, Object> doc = validator.normalize(Map.of("vin", "X1", "colour", "blue"));

        assertThat(doc).doesNotContainKey("colour");
    }

    @Test
    void keepsTypedOptionalFields() {
        Map<String, Object> doc = validator.normalize(Map.of(
                "make", "BMW", "model", "320d", "year", 2004,
                "photos", List.of("https://img.example/1.jpg"),
                "last_known_location", Map.of("lat", 9.03, "lng", 38.74),
                "owner_id", "u-7", "status", "imported"));

        assertThat(doc).containsEntry("year", 2004)
                .containsEntry("photos", List.of("https://img.example/1.jpg"))
                .containsEntry("last_known_location", Map.of("lat", 9.03, "lng", 38.74))
                .containsEntry("status", "imported");
    }

    @Test
    void yearMustBeAPlausibleInteger() {
        assertThatThrownBy(() -> validator.normalize(Map.of("year", "old"))).hasMessageStartingWith("year:");
        assertThatThrownBy(() -> validator.normalize(Map.of("year", 1700))).hasMessageStartingWith("year:");
        assertThat(validator.normalize(Map.of("year", "1998"))).containsEntry("year", 1998);
    }

    @Test
    void photosMustBeHttpUrls() {
        assertThatThrownBy(() -> validator.normalize(Map.of("photos", List.of("https://ok.example/a.png", "ftp://x/y"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("photos[1]:");
    }

    @Test
    void locationMustBeAnObject() {
        assertThatThrownBy(() -> validator.normalize(Map.of("last_known_location", "Addis Ababa")))
                .hasMessageStartingWith("last_known_location:");
    }
}
