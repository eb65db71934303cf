package com.acme.streamer.spi;

import com.acme.streamer.domain.ReceivedMessage;

/**
 * Processes messages of one event type. Implementations are identified by a stable string
 * identity, by default their fully-qualified class name, so a failed delivery can be replayed
 * through the same receiver later.
 */
@FunctionalInterface
public interface MessageReceiver {

    /**
     * Handle one delivered message.
     *
     * @param message the message read from the stream
     * @throws Exception if processing fails; the failure is recorded for a later retry
     */
    void handle(ReceivedMessage message) throws Exception;
}
