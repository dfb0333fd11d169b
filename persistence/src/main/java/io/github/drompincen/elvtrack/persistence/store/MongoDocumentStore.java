package io.github.drompincen.elvtrack.persistence.store;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.elvtrack.persistence.document.RecordDocument;
import io.github.drompincen.elvtrack.persistence.repository.RecordRepository;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link DocumentStore} over the {@code records} Mongo collection. Ids are
 * ObjectId hex strings; updates are single {@code updateFirst} calls, so each one is
 * atomic for its document.
 */
@Component
@ConditionalOnProperty(name = "elvtrack.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);
    private static final String PAYLOAD = "payload.";

    private final RecordRepository recordRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoDocumentStore(RecordRepository recordRepository, MongoTemplate mongoTemplate, Clock clock) {
        this.recordRepository = recordRepository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public String insert(RecordKind kind, Map<String, Object> doc) {
        RecordDocument record = new RecordDocument();
        record.setId(new ObjectId().toHexString());
        record.setKind(kind);
        Map<String, Object> payload = new LinkedHashMap<>(doc);
        payload.remove(RecordFields.ID);
        record.setPayload(payload);
        Instant now = clock.instant();
        record.setCreateDate(now);
        record.setUpdateDate(now);
        return guard("insert " + kind.collection(), () -> recordRepository.insert(record)).getId();
    }

    @Override
    public Optional<Map<String, Object>> findOne(RecordKind kind, String id) {
        return guard("find " + kind.collection(), () -> recordRepository.findByIdAndKind(id, kind))
                .map(this::toView);
    }

    @Override
    public List<Map<String, Object>> findMany(RecordKind kind, Map<String, Object> filter, Sort sort, int limit) {
        Query query = new Query().addCriteria(Criteria.where("kind").is(kind));
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            query.addCriteria(Criteria.where(PAYLOAD + entry.getKey()).is(entry.getValue()));
        }
        if (sort.isSorted()) {
            List<Sort.Order> orders = sort.stream()
                    .map(o -> new Sort.Order(o.getDirection(), PAYLOAD + o.getProperty()))
                    .collect(Collectors.toList());
            query.with(Sort.by(orders));
        }
        if (limit > 0) {
            query.limit(limit);
        }
        return guard("list " + kind.collection(), () -> mongoTemplate.find(query, RecordDocument.class))
                .stream().map(this::toView).collect(Collectors.toList());
    }

    @Override
    public boolean update(RecordKind kind, String id, Map<String, Object> patch) {
        Query query = new Query()
                .addCriteria(Criteria.where("id").is(id))
                .addCriteria(Criteria.where("kind").is(kind));
        Update update = new Update();
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            if (entry.getValue() == null) {
                update.unset(PAYLOAD + entry.getKey());
            } else {
                update.set(PAYLOAD + entry.getKey(), entry.getValue());
            }
        }
        update.set("updateDate", clock.instant());
        UpdateResult result = guard("update " + kind.collection(),
                () -> mongoTemplate.updateFirst(query, update, RecordDocument.class));
        return result.getMatchedCount() > 0;
    }

    @Override
    public boolean isValidId(String id) {
        return id != null && ObjectId.isValid(id);
    }

    @Override
    public StoreDiagnostics describe() {
        String database = null;
        try {
            database = mongoTemplate.getDb().getName();
            List<String> collections = mongoTemplate.getCollectionNames().stream()
                    .sorted().limit(10).collect(Collectors.toList());
            return new StoreDiagnostics("mongo", database, true, collections, null);
        } catch (DataAccessException | MongoException e) {
            log.warn("Store diagnostics failed: {}", e.getMessage());
            return new StoreDiagnostics("mongo", database, false, List.of(), e.getMessage());
        }
    }

    /** Payload plus id; BSON dates are surfaced as instants. */
    private Map<String, Object> toView(RecordDocument record) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(RecordFields.ID, record.getId());
        if (record.getPayload() != null) {
            record.getPayload().forEach((k, v) -> view.put(k, v instanceof Date d ? d.toInstant() : v));
        }
        return view;
    }

    private <T> T guard(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException e) {
            log.error("Store unavailable during {}", action, e);
            throw new StoreUnavailableException("Document store unavailable during " + action, e);
        }
    }
}
