package com.acme.streamer.failure;

import com.acme.streamer.domain.FailedMessage;
import com.acme.streamer.domain.ReceivedMessage;
import com.acme.streamer.spi.MessageReceiver;
import java.util.List;

/**
 * Records messages a receiver failed to process and replays them on request. Retries are never
 * scheduled automatically.
 */
public interface MessagesFailer {

    /**
     * Record that {@code receiver} failed to process {@code message}.
     */
    void store(ReceivedMessage message, MessageReceiver receiver, Exception e);

    /**
     * Replay a failed message through the receiver that originally failed.
     *
     * @throws com.acme.streamer.core.MessageRetryFailedException if the receiver cannot be
     *     resolved, the message is gone from its stream, or the receiver fails again
     */
    void retry(FailedMessage message);

    /**
     * Replay the failed message stored under {@code id}.
     *
     * @throws com.acme.streamer.core.MessageRetryFailedException if no failure is stored for the
     *     id, or the retry fails
     * @throws NullPointerException if {@code id} is null
     */
    void retry(String id);

    /** Replay every stored failure. A failing record does not stop the others. */
    RetryReport retryAll();

    /** Replay the stored failures selected by {@code filter}. */
    RetryReport retryBy(FailureFilter filter);

    /** Stored failures selected by {@code filter}, oldest first. */
    List<FailedMessage> failed(FailureFilter filter);
}
