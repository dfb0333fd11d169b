package io.github.drompincen.elvtrack.runtime.record;

import io.github.drompincen.elvtrack.persistence.store.DocumentStore;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import io.github.drompincen.elvtrack.runtime.rules.DerivedStateRuleEngine;
import io.github.drompincen.elvtrack.runtime.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Records lifecycle events. Events are immutable once stored; logging one runs the
 * derived-state rules synchronously before returning, so a following read of the
 * vehicle already sees the new status.
 */
@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final DocumentStore store;
    private final EventValidator validator;
    private final DerivedStateRuleEngine ruleEngine;

    public EventService(DocumentStore store, EventValidator validator, DerivedStateRuleEngine ruleEngine) {
        this.store = store;
        this.validator = validator;
        this.ruleEngine = ruleEngine;
    }

    public Map<String, Object> logEvent(Map<String, Object> payload) {
        Map<String, Object> doc = validator.normalize(payload);
        String id = store.insert(RecordKind.EVENT, doc);
        log.info("Logged {} event {} for vehicle {}", doc.get(RecordFields.EVENT_TYPE), id, doc.get(RecordFields.VEHICLE_ID));
        Map<String, Object> event = Records.withId(id, doc);
        ruleEngine.apply(event);
        return event;
    }
}
