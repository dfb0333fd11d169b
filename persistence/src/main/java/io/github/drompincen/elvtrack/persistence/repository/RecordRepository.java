package io.github.drompincen.elvtrack.persistence.repository;

import io.github.drompincen.elvtrack.persistence.document.RecordDocument;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface RecordRepository extends MongoRepository<RecordDocument, String> {

    Optional<RecordDocument> findByIdAndKind(String id, RecordKind kind);
}
