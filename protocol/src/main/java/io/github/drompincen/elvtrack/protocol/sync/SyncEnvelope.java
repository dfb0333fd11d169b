package io.github.drompincen.elvtrack.protocol.sync;

import java.util.List;

/** A batch of mutations submitted together. Envelope order does not decide apply order. */
public record SyncEnvelope(List<Mutation> mutations) {}
