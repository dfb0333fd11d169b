package io.github.drompincen.elvtrack.runtime.record;

import io.github.drompincen.elvtrack.runtime.validation.ValidationException;

/** Page size rule shared by every listing endpoint. */
public final class ListLimits {

    public static final int DEFAULT = 50;
    public static final int MAX = 200;

    private ListLimits() {}

    public static int check(Integer limit) {
        if (limit == null) return DEFAULT;
        if (limit < 1 || limit > MAX) {
            throw new ValidationException("limit", "must be between 1 and " + MAX + ", got " + limit);
        }
        return limit;
    }
}
