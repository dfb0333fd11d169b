package io.github.drompincen.elvtrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DamageLevel implements WireEnum {
    NONE("none"), MINOR("minor"), MODERATE("moderate"), SEVERE("severe"), UNKNOWN("unknown");

    private final String wireValue;

    DamageLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
