package com.acme.streamer.receiver;

import com.acme.streamer.spi.MessageReceiver;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of receiver factories keyed by receiver identity. Populated by the host application at
 * startup. Pure POJO - no framework dependencies.
 */
public class ReceiverRegistry {
    private static final Logger log = LoggerFactory.getLogger(ReceiverRegistry.class);

    private final Map<String, Supplier<?>> factories = new ConcurrentHashMap<>();

    /** Register a receiver type under its class name. */
    public <T extends MessageReceiver> void register(Class<T> receiverType, Supplier<? extends T> factory) {
        register(Receivers.identityOf(receiverType), factory);
    }

    /**
     * Register a factory under an explicit key. The factory is not required to produce a
     * MessageReceiver; that is checked when the key is resolved.
     *
     * @throws IllegalStateException if a factory is already registered under the key
     */
    public void register(String identity, Supplier<?> factory) {
        if (factories.putIfAbsent(identity, factory) != null) {
            String error = "Receiver already registered for identity: " + identity;
            log.error(error);
            throw new IllegalStateException(error);
        }
        log.info("Registering receiver: {}", identity);
    }

    public Optional<Supplier<?>> lookup(String identity) {
        return Optional.ofNullable(factories.get(identity));
    }

    public boolean contains(String identity) {
        return factories.containsKey(identity);
    }

    public Set<String> identities() {
        return Set.copyOf(factories.keySet());
    }
}
