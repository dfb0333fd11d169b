package io.github.drompincen.elvtrack.protocol.sync;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.drompincen.elvtrack.protocol.api.WireEnum;

public enum MutationStatus implements WireEnum {
    OK("ok"),
    IGNORED("ignored"),
    ERROR("error");

    private final String wireValue;

    MutationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
