package com.acme.streamer.receiver;

import com.acme.streamer.core.InvalidReceiverException;
import com.acme.streamer.core.UnknownReceiverException;
import com.acme.streamer.spi.MessageReceiver;
import com.acme.streamer.spi.ReceiverResolver;
import java.util.function.Supplier;

/** Resolves receivers from a {@link ReceiverRegistry}. */
public class RegistryReceiverResolver implements ReceiverResolver {
    private final ReceiverRegistry registry;

    public RegistryReceiverResolver(ReceiverRegistry registry) {
        this.registry = registry;
    }

    @Override
    public MessageReceiver resolve(String identity) {
        Supplier<?> factory =
                registry.lookup(identity).orElseThrow(() -> new UnknownReceiverException(identity));

        Object receiver = factory.get();
        if (!(receiver instanceof MessageReceiver)) {
            throw new InvalidReceiverException(
                    identity, receiver == null ? Void.class : receiver.getClass());
        }
        return (MessageReceiver) receiver;
    }
}
