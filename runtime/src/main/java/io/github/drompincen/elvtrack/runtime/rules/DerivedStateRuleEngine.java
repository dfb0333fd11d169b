package io.github.drompincen.elvtrack.runtime.rules;

import io.github.drompincen.elvtrack.persistence.store.DocumentStore;
import io.github.drompincen.elvtrack.protocol.api.EventType;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import io.github.drompincen.elvtrack.protocol.api.VehicleStatus;
import io.github.drompincen.elvtrack.protocol.api.WireEnum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies vehicle status changes implied by stored events.
 *
 * <table>
 *   <tr><th>event_type</th><th>vehicle status</th></tr>
 *   <tr><td>dismantling</td><td>dismantled</td></tr>
 *   <tr><td>scrap</td><td>scrapped</td></tr>
 * </table>
 *
 * <p>Other event types have no effect. When the event has no vehicle reference, or the
 * reference does not resolve to a stored vehicle, the rule is skipped without error;
 * the event itself stays recorded. The update is one atomic store write that also
 * stamps {@code updated_at}; later events simply overwrite the status.</p>
 */
@Component
public class DerivedStateRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(DerivedStateRuleEngine.class);

    private static final Map<EventType, VehicleStatus> RULES = new EnumMap<>(EventType.class);

    static {
        RULES.put(EventType.DISMANTLING, VehicleStatus.DISMANTLED);
        RULES.put(EventType.SCRAP, VehicleStatus.SCRAPPED);
    }

    private final DocumentStore store;
    private final Clock clock;

    public DerivedStateRuleEngine(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /** The status the event implies for its vehicle, if any rule matches its type. */
    public Optional<VehicleStatus> statusFor(EventType type) {
        return Optional.ofNullable(RULES.get(type));
    }

    /**
     * Runs the rules for a persisted event.
     *
     * @return the status written to the vehicle, or empty when nothing changed
     */
    public Optional<VehicleStatus> apply(Map<String, Object> event) {
        Object rawType = event.get(RecordFields.EVENT_TYPE);
        Optional<VehicleStatus> target = WireEnum.fromWire(EventType.class, rawType instanceof String s ? s : null)
                .flatMap(this::statusFor);
        if (target.isEmpty()) {
            return Optional.empty();
        }

        Object vehicleId = event.get(RecordFields.VEHICLE_ID);
        if (!(vehicleId instanceof String id) || !store.isValidId(id)) {
            log.debug("Event {} has no resolvable vehicle reference ({}), skipping status rule",
                    event.get(RecordFields.ID), vehicleId);
            return Optional.empty();
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(RecordFields.STATUS, target.get().wireValue());
        patch.put(RecordFields.UPDATED_AT, clock.instant());
        if (!store.update(RecordKind.VEHICLE, id, patch)) {
            log.debug("Vehicle {} referenced by event {} does not exist, skipping status rule",
                    id, event.get(RecordFields.ID));
            return Optional.empty();
        }
        log.info("Vehicle {} status -> {} (event {})", id, target.get().wireValue(), event.get(RecordFields.ID));
        return target;
    }
}
