package io.github.drompincen.elvtrack.persistence.store;

import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic create/read/update/list access to schemaless records, one logical
 * collection per {@link RecordKind}.
 *
 * <p>Documents handed out by the store are plain maps holding the payload fields plus
 * the store-assigned id under {@code "id"}. Callers may modify the returned maps
 * freely; changes only reach the store through {@link #update}.</p>
 *
 * <p>Every call blocks until the store has completed it. Implementations throw
 * {@link StoreUnavailableException} when the backing store cannot be reached.</p>
 */
public interface DocumentStore {

    /** Persists {@code doc} and returns the id assigned to it. */
    String insert(RecordKind kind, Map<String, Object> doc);

    Optional<Map<String, Object>> findOne(RecordKind kind, String id);

    /**
     * Documents whose payload fields equal every entry of {@code filter}, ordered by
     * {@code sort} (payload field names), at most {@code limit} of them. A limit of
     * zero or less means no limit.
     */
    List<Map<String, Object>> findMany(RecordKind kind, Map<String, Object> filter, Sort sort, int limit);

    default List<Map<String, Object>> findMany(RecordKind kind, Map<String, Object> filter, int limit) {
        return findMany(kind, filter, Sort.unsorted(), limit);
    }

    /**
     * Sets each patch entry on the document (a null value removes the field) as a
     * single atomic write. Returns false when no such document exists.
     */
    boolean update(RecordKind kind, String id, Map<String, Object> patch);

    /** Whether {@code id} has the shape of an id this store could have assigned. */
    boolean isValidId(String id);

    /** Never throws; an unreachable store is reported in the result. */
    StoreDiagnostics describe();
}
