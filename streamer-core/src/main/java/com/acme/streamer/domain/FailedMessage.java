package com.acme.streamer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One failed delivery of a stream message to a receiver.
 *
 * <p>Serialized flat with the field names {@code id}, {@code stream}, {@code receiver},
 * {@code error} and {@code date}. {@code recordedAt} is left null by callers and stamped by the
 * repository when the record is stored.
 */
public record FailedMessage(
        @JsonProperty("id") String id,
        @JsonProperty("stream") String streamName,
        @JsonProperty("receiver") String receiver,
        @JsonProperty("error") String error,
        @JsonProperty("date") Instant recordedAt) {

    public FailedMessage {
        Objects.requireNonNull(id, "id");
        streamName = streamName == null ? "" : streamName;
        receiver = receiver == null ? "" : receiver;
        error = error == null ? "" : error;
    }

    public FailedMessage(String id, String streamName, String receiver, String error) {
        this(id, streamName, receiver, error, null);
    }

    public FailedMessage withRecordedAt(Instant recordedAt) {
        return new FailedMessage(id, streamName, receiver, error, recordedAt);
    }

    @JsonIgnore
    public boolean isRecorded() {
        return recordedAt != null;
    }

    /**
     * Whether this record describes the same failure as {@code other}. Timestamps are compared only
     * when both records carry one, so an unstamped reference matches the stored copy of itself.
     */
    public boolean matches(FailedMessage other) {
        if (other == null) {
            return false;
        }
        boolean sameFailure =
                id.equals(other.id)
                        && streamName.equals(other.streamName)
                        && receiver.equals(other.receiver)
                        && error.equals(other.error);
        if (!sameFailure) {
            return false;
        }
        return recordedAt == null || other.recordedAt == null || recordedAt.equals(other.recordedAt);
    }
}
