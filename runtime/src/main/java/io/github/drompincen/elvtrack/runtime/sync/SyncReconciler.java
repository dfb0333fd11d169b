package io.github.drompincen.elvtrack.runtime.sync;

import io.github.drompincen.elvtrack.persistence.store.StoreUnavailableException;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.WireEnum;
import io.github.drompincen.elvtrack.protocol.sync.Mutation;
import io.github.drompincen.elvtrack.protocol.sync.MutationOp;
import io.github.drompincen.elvtrack.protocol.sync.MutationResult;
import io.github.drompincen.elvtrack.protocol.sync.MutationStatus;
import io.github.drompincen.elvtrack.protocol.sync.SyncResponse;
import io.github.drompincen.elvtrack.runtime.record.EventService;
import io.github.drompincen.elvtrack.runtime.record.PartService;
import io.github.drompincen.elvtrack.runtime.record.VehicleService;
import io.github.drompincen.elvtrack.runtime.validation.Timestamps;
import io.github.drompincen.elvtrack.runtime.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Replays a batch of offline mutations against the store.
 *
 * <p>Mutations are applied one at a time in ascending {@code client_timestamp} order;
 * ties keep their envelope order. Each mutation stands alone: a failure becomes an
 * {@code error} result and the batch carries on, and an unrecognised {@code op} is
 * reported as {@code ignored}. Nothing is rolled back, so the results tell the client
 * exactly which entries to resubmit. Only an unreachable store aborts the batch.</p>
 *
 * <p>The reconciler keeps no state between batches. Within a batch it remembers the
 * ids created for {@code client_ref}s so later mutations can point at them.</p>
 */
@Service
public class SyncReconciler {

    private static final Logger log = LoggerFactory.getLogger(SyncReconciler.class);

    private final VehicleService vehicleService;
    private final EventService eventService;
    private final PartService partService;
    private final Clock clock;

    public SyncReconciler(VehicleService vehicleService, EventService eventService,
                          PartService partService, Clock clock) {
        this.vehicleService = vehicleService;
        this.eventService = eventService;
        this.partService = partService;
        this.clock = clock;
    }

    public SyncResponse reconcile(List<Mutation> batch) {
        List<Mutation> mutations = batch != null ? batch : List.of();
        for (int i = 0; i < mutations.size(); i++) {
            if (mutations.get(i) == null) {
                throw new ValidationException("mutations[" + i + "]", "must not be null");
            }
        }
        log.info("Reconciling {} mutation(s) from client(s) {}", mutations.size(),
                mutations.stream().map(Mutation::clientId).filter(Objects::nonNull)
                        .collect(Collectors.toCollection(TreeSet::new)));

        List<Pending> ordered = new ArrayList<>(mutations.size());
        for (Mutation m : mutations) {
            ordered.add(Pending.of(m));
        }
        // List.sort is stable: equal timestamps keep envelope order.
        ordered.sort(Comparator.comparing(Pending::timestamp, Comparator.nullsLast(Comparator.naturalOrder())));

        Map<String, String> createdRefs = new HashMap<>();
        List<MutationResult> results = new ArrayList<>(ordered.size());
        for (Pending pending : ordered) {
            results.add(apply(pending, createdRefs));
        }

        Map<MutationStatus, Long> tally = results.stream()
                .collect(Collectors.groupingBy(MutationResult::status, () -> new EnumMap<>(MutationStatus.class),
                        Collectors.counting()));
        log.info("Sync batch done: {} ok, {} ignored, {} error",
                tally.getOrDefault(MutationStatus.OK, 0L),
                tally.getOrDefault(MutationStatus.IGNORED, 0L),
                tally.getOrDefault(MutationStatus.ERROR, 0L));
        return new SyncResponse(results, clock.instant());
    }

    private MutationResult apply(Pending pending, Map<String, String> createdRefs) {
        Mutation m = pending.mutation();
        Optional<MutationOp> op = WireEnum.fromWire(MutationOp.class, m.op());
        if (op.isEmpty()) {
            log.debug("Ignoring unknown op '{}' from client {}", m.op(), m.clientId());
            return MutationResult.ignored(m, "unknown op '" + m.op() + "'");
        }
        try {
            if (pending.timestampError() != null) {
                throw pending.timestampError();
            }
            if (m.data() == null) {
                throw new ValidationException("data", "is required");
            }
            Map<String, Object> data = backfillVehicleRef(m.data(), createdRefs);
            log.debug("Applying {} from client {} at {}", m.op(), m.clientId(), pending.timestamp());
            Map<String, Object> stored = switch (op.get()) {
                case CREATE_VEHICLE -> vehicleService.create(data);
                case LOG_EVENT -> eventService.logEvent(data);
                case REGISTER_PART -> partService.register(data);
            };
            String id = (String) stored.get(RecordFields.ID);
            if (op.get() == MutationOp.CREATE_VEHICLE && m.clientRef() != null) {
                createdRefs.put(m.clientRef(), id);
            }
            return MutationResult.ok(m, id);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (ValidationException e) {
            log.warn("Rejected {} from client {}: {}", m.op(), m.clientId(), e.getMessage());
            return MutationResult.error(m, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to apply {} from client {}", m.op(), m.clientId(), e);
            return MutationResult.error(m, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static Map<String, Object> backfillVehicleRef(Map<String, Object> data, Map<String, String> createdRefs) {
        Object ref = data.get(RecordFields.VEHICLE_ID);
        if (ref instanceof String s && createdRefs.containsKey(s)) {
            Map<String, Object> copy = new LinkedHashMap<>(data);
            copy.put(RecordFields.VEHICLE_ID, createdRefs.get(s));
            return copy;
        }
        return data;
    }

    /** A mutation with its parsed timestamp; unparsable or missing timestamps sort last. */
    private record Pending(Mutation mutation, Instant timestamp, ValidationException timestampError) {

        static Pending of(Mutation m) {
            if (m.clientTimestamp() == null) {
                return new Pending(m, null, new ValidationException("client_timestamp", "is required"));
            }
            try {
                return new Pending(m, Timestamps.parse("client_timestamp", m.clientTimestamp()), null);
            } catch (ValidationException e) {
                return new Pending(m, null, e);
            }
        }
    }
}
