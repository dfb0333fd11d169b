package io.github.drompincen.elvtrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of lifecycle event that can be logged against a vehicle. There is no
 * {@code unknown} member: an event must always say what happened.
 */
public enum EventType implements WireEnum {
    OWNERSHIP_CHANGE("ownership_change"),
    DISMANTLING("dismantling"),
    RECYCLING("recycling"),
    SCRAP("scrap"),
    INSPECTION("inspection"),
    LOCATION_UPDATE("location_update"),
    NOTE("note");

    private final String wireValue;

    EventType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
