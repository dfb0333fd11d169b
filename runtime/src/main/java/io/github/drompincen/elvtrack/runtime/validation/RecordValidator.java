package io.github.drompincen.elvtrack.runtime.validation;

import java.util.Map;

/**
 * Structural validation for one entity kind. Validators never touch the store.
 */
public interface RecordValidator {

    /**
     * Returns the normalized document: known fields only, enum fields as wire
     * literals with absent ones defaulted, timestamps as {@link java.time.Instant}.
     *
     * @throws ValidationException naming the first offending field
     */
    Map<String, Object> normalize(Map<String, Object> raw);
}
