package com.acme.streamer.dispatch;

import java.util.List;

/**
 * Outcome of delivering one message to its receivers.
 *
 * @param messageId id of the delivered message
 * @param delivered number of receivers that processed it
 * @param failedReceivers identities of receivers whose failure was recorded
 */
public record DispatchResult(String messageId, int delivered, List<String> failedReceivers) {

    public DispatchResult {
        failedReceivers = List.copyOf(failedReceivers);
    }

    public boolean hasFailures() {
        return !failedReceivers.isEmpty();
    }
}
