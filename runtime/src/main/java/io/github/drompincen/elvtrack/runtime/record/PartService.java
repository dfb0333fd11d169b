package io.github.drompincen.elvtrack.runtime.record;

import io.github.drompincen.elvtrack.persistence.store.DocumentStore;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import io.github.drompincen.elvtrack.runtime.validation.PartValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class PartService {

    private static final Logger log = LoggerFactory.getLogger(PartService.class);

    private final DocumentStore store;
    private final PartValidator validator;

    public PartService(DocumentStore store, PartValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    public Map<String, Object> register(Map<String, Object> payload) {
        Map<String, Object> doc = validator.normalize(payload);
        String id = store.insert(RecordKind.PART, doc);
        log.info("Registered part {} '{}' from vehicle {}", id, doc.get("name"), doc.get(RecordFields.VEHICLE_ID));
        return Records.withId(id, doc);
    }

    public List<Map<String, Object>> list(String vehicleId, Integer limit) {
        int checked = ListLimits.check(limit);
        Map<String, Object> filter = new LinkedHashMap<>();
        if (vehicleId != null) {
            filter.put(RecordFields.VEHICLE_ID, vehicleId);
        }
        return store.findMany(RecordKind.PART, filter, checked);
    }
}
