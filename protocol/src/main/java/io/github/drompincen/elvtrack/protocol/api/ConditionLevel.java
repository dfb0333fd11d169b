package io.github.drompincen.elvtrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionLevel implements WireEnum {
    GOOD("good"), FAIR("fair"), POOR("poor"), UNKNOWN("unknown");

    private final String wireValue;

    ConditionLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
