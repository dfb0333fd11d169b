package io.github.drompincen.elvtrack.runtime.record;

import io.github.drompincen.elvtrack.persistence.store.DocumentStore;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import io.github.drompincen.elvtrack.protocol.api.VehicleStatus;
import io.github.drompincen.elvtrack.runtime.validation.VehicleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class VehicleService {

    private static final Logger log = LoggerFactory.getLogger(VehicleService.class);

    private final DocumentStore store;
    private final VehicleValidator validator;

    public VehicleService(DocumentStore store, VehicleValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    public Map<String, Object> create(Map<String, Object> payload) {
        Map<String, Object> doc = validator.normalize(payload);
        String id = store.insert(RecordKind.VEHICLE, doc);
        log.info("Created vehicle {} (vin={}, status={})", id, doc.get("vin"), doc.get(RecordFields.STATUS));
        return Records.withId(id, doc);
    }

    public List<Map<String, Object>> list(VehicleStatus status, Integer limit) {
        int checked = ListLimits.check(limit);
        Map<String, Object> filter = new LinkedHashMap<>();
        if (status != null) {
            filter.put(RecordFields.STATUS, status.wireValue());
        }
        return store.findMany(RecordKind.VEHICLE, filter, checked);
    }

    public Map<String, Object> get(String vehicleId) {
        requireValidId(vehicleId);
        return store.findOne(RecordKind.VEHICLE, vehicleId)
                .orElseThrow(() -> new RecordNotFoundException("vehicle", vehicleId));
    }

    /** Every event that references the vehicle, oldest {@code occurred_at} first. */
    public List<Map<String, Object>> history(String vehicleId) {
        requireValidId(vehicleId);
        return store.findMany(RecordKind.EVENT, Map.of(RecordFields.VEHICLE_ID, vehicleId),
                Sort.by(Sort.Direction.ASC, RecordFields.OCCURRED_AT), 0);
    }

    private void requireValidId(String vehicleId) {
        if (!store.isValidId(vehicleId)) {
            throw new InvalidRecordIdException("vehicle", vehicleId);
        }
    }
}
