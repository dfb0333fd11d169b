package io.github.drompincen.elvtrack.persistence.store;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.elvtrack.persistence.document.RecordDocument;
import io.github.drompincen.elvtrack.persistence.repository.RecordRepository;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoDocumentStoreTest {

    @Mock private RecordRepository recordRepository;
    @Mock private MongoTemplate mongoTemplate;

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(recordRepository, mongoTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void insertStoresPayloadUnderKindWithObjectIdHex() {
        when(recordRepository.insert(any(RecordDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        String id = store.insert(RecordKind.VEHICLE, Map.of("vin", "X1", "id", "client-supplied"));

        ArgumentCaptor<RecordDocument> captor = ArgumentCaptor.forClass(RecordDocument.class);
        verify(recordRepository).insert(captor.capture());
        RecordDocument saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo(id);
        assertThat(store.isValidId(id)).isTrue();
        assertThat(saved.getKind()).isEqualTo(RecordKind.VEHICLE);
        assertThat(saved.getPayload()).containsEntry("vin", "X1").doesNotContainKey("id");
        assertThat(saved.getCreateDate()).isEqualTo(NOW);
        assertThat(saved.getUpdateDate()).isEqualTo(NOW);
    }

    @Test
    void findOneSurfacesIdAndConvertsDates() {
        RecordDocument doc = new RecordDocument();
        doc.setId("65f1c0ffee0000000000abcd");
        doc.setKind(RecordKind.EVENT);
        Date when = Date.from(Instant.parse("2024-03-01T10:00:00Z"));
        doc.setPayload(new LinkedHashMap<>(Map.of("event_type", "note", "occurred_at", when)));
        when(recordRepository.findByIdAndKind("65f1c0ffee0000000000abcd", RecordKind.EVENT))
                .thenReturn(Optional.of(doc));

        Map<String, Object> view = store.findOne(RecordKind.EVENT, "65f1c0ffee0000000000abcd").orElseThrow();

        assertThat(view).containsEntry("id", "65f1c0ffee0000000000abcd")
                .containsEntry("event_type", "note")
                .containsEntry("occurred_at", Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void findManyTranslatesFilterSortAndLimitToPayloadPaths() {
        when(mongoTemplate.find(any(Query.class), eq(RecordDocument.class))).thenReturn(List.of());

        store.findMany(RecordKind.EVENT, Map.of("vehicle_id", "v1"), Sort.by(Sort.Direction.ASC, "occurred_at"), 25);

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(RecordDocument.class));
        Query query = captor.getValue();
        assertThat(query.getQueryObject().get("kind")).isEqualTo(RecordKind.EVENT);
        assertThat(query.getQueryObject().get("payload.vehicle_id")).isEqualTo("v1");
        assertThat(query.getSortObject()).isEqualTo(new Document("payload.occurred_at", 1));
        assertThat(query.getLimit()).isEqualTo(25);
    }

    @Test
    void updateIsSingleAtomicWriteOnPayloadFields() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(RecordDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        boolean matched = store.update(RecordKind.VEHICLE, "65f1c0ffee0000000000abcd", Map.of("status", "scrapped"));

        assertThat(matched).isTrue();
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, times(1)).updateFirst(any(Query.class), captor.capture(), eq(RecordDocument.class));
        Document set = (Document) captor.getValue().getUpdateObject().get("$set");
        assertThat(set.get("payload.status")).isEqualTo("scrapped");
        assertThat(set.get("updateDate")).isEqualTo(NOW);
    }

    @Test
    void updateReportsMissingDocument() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(RecordDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.update(RecordKind.VEHICLE, "65f1c0ffee0000000000abcd", Map.of("status", "sold"))).isFalse();
    }

    @Test
    void connectivityFailureBecomesStoreUnavailable() {
        when(recordRepository.insert(any(RecordDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("timed out"));

        assertThatThrownBy(() -> store.insert(RecordKind.PART, Map.of("name", "door")))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("insert part");
    }

    @Test
    void describeReportsUnreachableStoreWithoutThrowing() {
        MongoDatabase db = mock(MongoDatabase.class);
        when(db.getName()).thenReturn("elvtrack");
        when(mongoTemplate.getDb()).thenReturn(db);
        when(mongoTemplate.getCollectionNames()).thenThrow(new DataAccessResourceFailureException("down"));

        StoreDiagnostics diagnostics = store.describe();

        assertThat(diagnostics.reachable()).isFalse();
        assertThat(diagnostics.database()).isEqualTo("elvtrack");
        assertThat(diagnostics.error()).contains("down");
    }

    @Test
    void describeListsCollections() {
        MongoDatabase db = mock(MongoDatabase.class);
        when(db.getName()).thenReturn("elvtrack");
        when(mongoTemplate.getDb()).thenReturn(db);
        when(mongoTemplate.getCollectionNames()).thenReturn(new HashSet<>(Set.of("records")));

        StoreDiagnostics diagnostics = store.describe();

        assertThat(diagnostics.reachable()).isTrue();
        assertThat(diagnostics.collections()).containsExactly("records");
    }
}
