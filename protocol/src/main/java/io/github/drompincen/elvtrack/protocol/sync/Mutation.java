package io.github.drompincen.elvtrack.protocol.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One write recorded by a client while offline.
 *
 * <p>{@code op} stays a raw string so that operations introduced by newer clients
 * can be reported as ignored instead of failing deserialization of the whole
 * envelope. {@code clientTimestamp} is kept as submitted (ISO-8601 text or epoch
 * millis) and parsed by the reconciler, which turns a bad value into a
 * per-mutation error.</p>
 *
 * <p>{@code clientRef} is an optional client-chosen handle. Later mutations in the
 * same batch may put it in {@code data.vehicle_id} to point at the record this
 * mutation creates.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Mutation(
        String op,
        Map<String, Object> data,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_timestamp") Object clientTimestamp,
        @JsonProperty("client_ref") String clientRef
) {}
