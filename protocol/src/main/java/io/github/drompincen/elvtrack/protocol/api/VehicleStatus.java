package io.github.drompincen.elvtrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VehicleStatus implements WireEnum {
    IMPORTED("imported"), ACTIVE("active"), DISMANTLED("dismantled"), SCRAPPED("scrapped"), SOLD("sold"), UNKNOWN("unknown");

    private final String wireValue;

    VehicleStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
