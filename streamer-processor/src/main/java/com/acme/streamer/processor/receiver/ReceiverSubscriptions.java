package com.acme.streamer.processor.receiver;

import com.acme.streamer.dispatch.MessageDispatcher;
import com.acme.streamer.receiver.Receivers;
import com.acme.streamer.spi.MessageReceiver;
import io.micronaut.context.BeanContext;
import io.micronaut.context.annotation.Context;
import io.micronaut.inject.BeanDefinition;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Subscribes every {@link MessageReceiver} bean annotated with {@link Listens} to the dispatcher
 * at startup.
 */
@Context
@RequiredArgsConstructor
@Slf4j
public class ReceiverSubscriptions {
    private final BeanContext beanContext;
    private final MessageDispatcher dispatcher;

    private final Map<String, String> subscribed = new HashMap<>();

    @PostConstruct
    public void subscribeReceivers() {
        log.info("Discovering stream receivers...");
        int subscriptions = 0;

        for (BeanDefinition<MessageReceiver> definition : beanContext.getBeanDefinitions(MessageReceiver.class)) {
            Listens listens = definition.getBeanType().getAnnotation(Listens.class);
            if (listens == null) {
                continue;
            }

            MessageReceiver receiver = beanContext.getBean(definition);
            String identity = Receivers.identityOf(receiver);
            for (String event : listens.value()) {
                String key = event + "|" + identity;
                if (subscribed.putIfAbsent(key, identity) != null) {
                    // proxy and target beans of the same class
                    continue;
                }
                dispatcher.subscribe(event, receiver);
                subscriptions++;
            }
        }

        log.info("Receiver discovery complete: {} subscription(s)", subscriptions);
    }
}
