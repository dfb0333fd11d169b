package io.github.drompincen.elvtrack.runtime.validation;

import io.github.drompincen.elvtrack.protocol.api.EventType;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.drompincen.elvtrack.runtime.validation.VehicleValidator.putIfPresent;

/**
 * Events require an {@code event_type}; a missing {@code occurred_at} is stamped with
 * the current server time.
 */
@Component
public class EventValidator implements RecordValidator {

    private final Clock clock;

    public EventValidator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<String, Object> normalize(Map<String, Object> raw) {
        PayloadReader in = new PayloadReader(raw);
        Map<String, Object> doc = new LinkedHashMap<>();
        putIfPresent(doc, RecordFields.VEHICLE_ID, in.optionalString(RecordFields.VEHICLE_ID));
        doc.put(RecordFields.EVENT_TYPE, in.enumValue(RecordFields.EVENT_TYPE, EventType.class, null).wireValue());
        putIfPresent(doc, "actor_id", in.optionalString("actor_id"));
        putIfPresent(doc, "notes", in.optionalString("notes"));
        putIfPresent(doc, "metadata", in.optionalObject("metadata"));
        putIfPresent(doc, "location", in.optionalObject("location"));
        Instant occurredAt = in.optionalInstant(RecordFields.OCCURRED_AT);
        doc.put(RecordFields.OCCURRED_AT, occurredAt != null ? occurredAt : clock.instant());
        return doc;
    }
}
