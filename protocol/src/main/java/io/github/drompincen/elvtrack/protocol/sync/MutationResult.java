package io.github.drompincen.elvtrack.protocol.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one mutation: {@code ok} with the generated id, {@code ignored} with a
 * reason, or {@code error} with a message. The client fields are echoed so a caller
 * can resubmit only the failed entries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MutationResult(
        String op,
        MutationStatus status,
        String id,
        String reason,
        String error,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_timestamp") Object clientTimestamp,
        @JsonProperty("client_ref") String clientRef
) {
    public static MutationResult ok(Mutation m, String id) {
        return new MutationResult(m.op(), MutationStatus.OK, id, null, null,
                m.clientId(), m.clientTimestamp(), m.clientRef());
    }

    public static MutationResult ignored(Mutation m, String reason) {
        return new MutationResult(m.op(), MutationStatus.IGNORED, null, reason, null,
                m.clientId(), m.clientTimestamp(), m.clientRef());
    }

    public static MutationResult error(Mutation m, String message) {
        return new MutationResult(m.op(), MutationStatus.ERROR, null, null, message,
                m.clientId(), m.clientTimestamp(), m.clientRef());
    }
}
