package io.github.drompincen.elvtrack.protocol.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SyncResponse(
        List<MutationResult> results,
        @JsonProperty("server_time") Instant serverTime
) {}
