package com.acme.streamer.dispatch;

import com.acme.streamer.domain.ReceivedMessage;
import com.acme.streamer.failure.MessagesFailer;
import com.acme.streamer.receiver.Receivers;
import com.acme.streamer.spi.MessageReceiver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers messages read from a stream to the receivers subscribed to their event name. A receiver
 * that throws has its failure stored for a later retry; the remaining receivers still get the
 * message.
 */
@Slf4j
public class MessageDispatcher {
    private final MessagesFailer failer;
    private final Map<String, List<MessageReceiver>> receivers = new ConcurrentHashMap<>();

    public MessageDispatcher(MessagesFailer failer) {
        this.failer = failer;
    }

    public void subscribe(String eventName, MessageReceiver receiver) {
        receivers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(receiver);
        log.info("Subscribed {} to event {}", Receivers.identityOf(receiver), eventName);
    }

    public List<MessageReceiver> receiversFor(String eventName) {
        return List.copyOf(receivers.getOrDefault(eventName, List.of()));
    }

    public DispatchResult dispatch(ReceivedMessage message) {
        List<MessageReceiver> targets = receiversFor(message.getEventName());
        if (targets.isEmpty()) {
            log.debug("No receivers for event '{}' id={}", message.getEventName(), message.id());
            return new DispatchResult(message.id(), 0, List.of());
        }

        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (MessageReceiver receiver : targets) {
            try {
                receiver.handle(message);
                delivered++;
            } catch (Exception e) {
                log.error(
                        "Receiver {} failed on message id={}",
                        Receivers.identityOf(receiver),
                        message.id(),
                        e);
                failer.store(message, receiver, e);
                failed.add(Receivers.identityOf(receiver));
            }
        }
        return new DispatchResult(message.id(), delivered, failed);
    }
}
