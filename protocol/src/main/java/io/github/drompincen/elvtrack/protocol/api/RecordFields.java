package io.github.drompincen.elvtrack.protocol.api;

/** Payload field names shared between the validators, the store and the REST layer. */
public final class RecordFields {

    public static final String ID = "id";
    public static final String VEHICLE_ID = "vehicle_id";
    public static final String STATUS = "status";
    public static final String EVENT_TYPE = "event_type";
    public static final String OCCURRED_AT = "occurred_at";
    public static final String UPDATED_AT = "updated_at";

    private RecordFields() {}
}
