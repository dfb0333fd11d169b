package io.github.drompincen.elvtrack.persistence.document;

import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A schemaless vehicle, event or part. The entity shape lives entirely in
 * {@link #payload}; {@link #kind} names the logical collection.
 */
@Document(collection = "records")
@CompoundIndexes({
        @CompoundIndex(name = "kind_status", def = "{'kind': 1, 'payload.status': 1}"),
        @CompoundIndex(name = "kind_vehicle_occurred", def = "{'kind': 1, 'payload.vehicle_id': 1, 'payload.occurred_at': 1}")
})
public class RecordDocument {

    @Id
    private String id;
    private RecordKind kind;
    private Map<String, Object> payload;
    private Instant createDate;
    private Instant updateDate;

    public RecordDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public RecordKind getKind() { return kind; }
    public void setKind(RecordKind kind) { this.kind = kind; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public Instant getCreateDate() { return createDate; }
    public void setCreateDate(Instant createDate) { this.createDate = createDate; }

    public Instant getUpdateDate() { return updateDate; }
    public void setUpdateDate(Instant updateDate) { this.updateDate = updateDate; }
}
