package io.github.drompincen.elvtrack.persistence.store;

import java.util.List;

/** Snapshot of store health for the diagnostic endpoint. {@code error} is null when reachable. */
public record StoreDiagnostics(
        String type,
        String database,
        boolean reachable,
        List<String> collections,
        String error
) {}
