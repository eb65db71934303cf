package com.acme.streamer.failure;

import com.acme.streamer.core.InvalidReceiverException;
import com.acme.streamer.core.MessageNotFoundException;
import com.acme.streamer.core.MessageRetryFailedException;
import com.acme.streamer.core.UnknownReceiverException;
import com.acme.streamer.domain.FailedMessage;
import com.acme.streamer.domain.Range;
import com.acme.streamer.domain.ReceivedMessage;
import com.acme.streamer.domain.StreamEntry;
import com.acme.streamer.receiver.Receivers;
import com.acme.streamer.repository.FailedMessageRepository;
import com.acme.streamer.spi.MessageReceiver;
import com.acme.streamer.spi.ReceiverResolver;
import com.acme.streamer.spi.StreamReader;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores failed deliveries and replays them through the receiver that failed.
 *
 * <p>A retry re-reads the message from its stream by id, hands a fresh {@link ReceivedMessage} to
 * the resolved receiver and then removes the original record. If the receiver fails again, a
 * replacement record is stored before the original is removed, so the failure stays visible the
 * whole time. A receiver that dies with an {@link Error} leaves the original record in place. Two
 * callers retrying the same id concurrently may both invoke the receiver; delivery
 * is at-least-once.
 */
public class FailedMessagesHandler implements MessagesFailer {
    private static final Logger LOG = LoggerFactory.getLogger(FailedMessagesHandler.class);

    static final String NO_MATCHING_MESSAGES = "No matching messages found on a Stream to retry";
    static final String NO_STORED_FAILURE = "No failed message stored under this id";

    private final FailedMessageRepository repository;
    private final ReceiverResolver receiverResolver;
    private final StreamReader streamReader;

    public FailedMessagesHandler(
            FailedMessageRepository repository,
            ReceiverResolver receiverResolver,
            StreamReader streamReader) {
        this.repository = repository;
        this.receiverResolver = receiverResolver;
        this.streamReader = streamReader;
    }

    @Override
    public void store(ReceivedMessage message, MessageReceiver receiver, Exception e) {
        storeFailure(
                new FailedMessage(
                        message.id(), message.getEventName(), Receivers.identityOf(receiver), errorText(e)));
    }

    private FailedMessage storeFailure(FailedMessage failure) {
        FailedMessage stored = repository.add(failure);
        LOG.warn(
                "Stored failed message id={} stream={} receiver={}: {}",
                stored.id(),
                stored.streamName(),
                stored.receiver(),
                stored.error());
        return stored;
    }

    @Override
    public void retry(FailedMessage message) {
        MessageReceiver receiver = makeReceiver(message);

        List<StreamEntry> entries =
                streamReader.readRange(message.streamName(), Range.single(message.id()), 1);
        if (entries == null || entries.size() != 1) {
            LOG.warn(
                    "Retry of id={} on stream={} found {} matching message(s)",
                    message.id(),
                    message.streamName(),
                    entries == null ? 0 : entries.size());
            throw new MessageRetryFailedException(
                    message,
                    NO_MATCHING_MESSAGES,
                    new MessageNotFoundException(
                            "Message " + message.id() + " not found on stream " + message.streamName()));
        }

        StreamEntry entry = entries.get(0);
        ReceivedMessage received = null;
        FailedMessage replacement = null;
        boolean handled = false;
        try {
            received = new ReceivedMessage(message.id(), entry.content());
            receiver.handle(received);
            handled = true;
            LOG.info("Retried message id={} through receiver={}", message.id(), message.receiver());
        } catch (Exception e) {
            if (received == null) {
                throw e instanceof RuntimeException runtime ? runtime : new IllegalStateException(e);
            }

            // Same stream and receiver identity as the original so the replacement resolves the same way
            replacement =
                    storeFailure(
                            new FailedMessage(
                                    received.id(), message.streamName(), message.receiver(), errorText(e)));
            throw new MessageRetryFailedException(message, errorText(e), e);
        } finally {
            // The original goes only once it is handled or superseded by a different replacement
            if (handled || (replacement != null && !replacement.matches(message))) {
                repository.remove(message);
            } else if (replacement == null) {
                LOG.error("Retry of id={} did not complete, keeping the stored failure", message.id());
            }
        }
    }

    @Override
    public void retry(String id) {
        Objects.requireNonNull(id, "id");
        FailedMessage message =
                repository
                        .find(id)
                        .orElseThrow(
                                () ->
                                        new MessageRetryFailedException(
                                                new FailedMessage(id, "", "", ""),
                                                NO_STORED_FAILURE,
                                                new MessageNotFoundException("No failed message stored for id " + id)));
        retry(message);
    }

    @Override
    public RetryReport retryAll() {
        return retryBy(FailureFilter.all());
    }

    @Override
    public RetryReport retryBy(FailureFilter filter) {
        List<FailedMessage> snapshot = failed(filter);
        if (snapshot.isEmpty()) {
            LOG.info("No failed messages to retry");
            return RetryReport.empty();
        }

        LOG.info("Retrying {} failed message(s)", snapshot.size());
        RetryReport.Builder report = new RetryReport.Builder();
        for (FailedMessage message : snapshot) {
            try {
                retry(message);
                report.retried(message);
            } catch (MessageRetryFailedException e) {
                LOG.warn("Retry failed for id={}: {}", message.id(), e.getReason());
                report.failed(message, e.getReason());
            }
        }

        RetryReport result = report.build();
        LOG.info(
                "Retry finished: {} succeeded, {} failed",
                result.retried().size(),
                result.failed().size());
        return result;
    }

    @Override
    public List<FailedMessage> failed(FailureFilter filter) {
        return repository.all().stream().filter(filter).toList();
    }

    private MessageReceiver makeReceiver(FailedMessage message) {
        try {
            return receiverResolver.resolve(message.receiver());
        } catch (UnknownReceiverException | InvalidReceiverException e) {
            LOG.warn("Cannot retry id={}: {}", message.id(), e.getMessage());
            throw new MessageRetryFailedException(message, e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Receiver {} could not be created for id={}", message.receiver(), message.id(), e);
            throw new MessageRetryFailedException(message, errorText(e), e);
        }
    }

    private static String errorText(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
