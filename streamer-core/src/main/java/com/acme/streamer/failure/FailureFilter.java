package com.acme.streamer.failure;

import com.acme.streamer.domain.FailedMessage;
import java.util.function.Predicate;

/**
 * Selects failed messages by id, stream and receiver. Null criteria match everything.
 */
public record FailureFilter(String id, String streamName, String receiver)
        implements Predicate<FailedMessage> {

    public static FailureFilter all() {
        return new FailureFilter(null, null, null);
    }

    public static FailureFilter byId(String id) {
        return new FailureFilter(id, null, null);
    }

    public static FailureFilter byStream(String streamName) {
        return new FailureFilter(null, streamName, null);
    }

    public static FailureFilter byReceiver(String receiver) {
        return new FailureFilter(null, null, receiver);
    }

    @Override
    public boolean test(FailedMessage message) {
        return (id == null || id.equals(message.id()))
                && (streamName == null || streamName.equals(message.streamName()))
                && (receiver == null || receiver.equals(message.receiver()));
    }
}
