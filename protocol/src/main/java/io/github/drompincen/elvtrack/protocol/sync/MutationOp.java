package io.github.drompincen.elvtrack.protocol.sync;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.drompincen.elvtrack.protocol.api.WireEnum;

/** Operations an offline client may replay through {@code /api/sync}. */
public enum MutationOp implements WireEnum {
    CREATE_VEHICLE("createVehicle"),
    LOG_EVENT("logEvent"),
    REGISTER_PART("registerPart");

    private final String wireValue;

    MutationOp(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }
}
