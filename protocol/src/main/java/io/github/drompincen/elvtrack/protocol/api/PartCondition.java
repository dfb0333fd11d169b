package io.github.drompincen.elvtrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PartCondition implements WireEnum {
    NEW("new"), USED("used"), DAMAGED("damaged"), UNKNOWN("unknown");

    private final String wireValue;

    PartCondition(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
