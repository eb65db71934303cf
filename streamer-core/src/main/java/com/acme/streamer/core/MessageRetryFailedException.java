package com.acme.streamer.core;

import com.acme.streamer.domain.FailedMessage;

/**
 * Raised when a failed message could not be retried. Carries the record the retry was started
 * for and the text of the underlying failure.
 */
public class MessageRetryFailedException extends RuntimeException {
    private final transient FailedMessage failedMessage;
    private final String reason;

    public MessageRetryFailedException(FailedMessage failedMessage, String reason) {
        this(failedMessage, reason, null);
    }

    public MessageRetryFailedException(FailedMessage failedMessage, String reason, Throwable cause) {
        super(
                String.format(
                        "Failed to retry [%s] on %s stream by [%s] listener. Error: %s",
                        failedMessage.id(), failedMessage.streamName(), failedMessage.receiver(), reason),
                cause);
        this.failedMessage = failedMessage;
        this.reason = reason;
    }

    public FailedMessage getFailedMessage() {
        return failedMessage;
    }

    public String getReason() {
        return reason;
    }
}
