package com.acme.streamer.processor.receiver;

import com.acme.streamer.core.InvalidReceiverException;
import com.acme.streamer.core.UnknownReceiverException;
import com.acme.streamer.receiver.ReceiverRegistry;
import com.acme.streamer.receiver.RegistryReceiverResolver;
import com.acme.streamer.spi.MessageReceiver;
import com.acme.streamer.spi.ReceiverResolver;
import io.micronaut.context.BeanContext;
import io.micronaut.core.reflect.ClassUtils;
import io.micronaut.core.reflect.InstantiationUtils;
import io.micronaut.inject.qualifiers.Qualifiers;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Resolves receiver identities against the application context.
 *
 * <p>Lookup order:
 *
 * <ol>
 *   <li>an explicit registration in the {@link ReceiverRegistry};
 *   <li>a fully-qualified class name: the bean of that type, or a new instance when the class is
 *       not a bean;
 *   <li>a {@link MessageReceiver} bean named by the identity.
 * </ol>
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BeanContextReceiverResolver implements ReceiverResolver {
    private final BeanContext beanContext;
    private final ReceiverRegistry registry;

    @Override
    public MessageReceiver resolve(String identity) {
        if (registry.contains(identity)) {
            return new RegistryReceiverResolver(registry).resolve(identity);
        }

        Optional<Class<?>> type = ClassUtils.forName(identity, BeanContextReceiverResolver.class.getClassLoader())
                .<Class<?>>map(found -> found);
        if (type.isPresent()) {
            return fromType(identity, type.get());
        }

        return beanContext
                .findBean(MessageReceiver.class, Qualifiers.byName(identity))
                .orElseThrow(() -> new UnknownReceiverException(identity));
    }

    private MessageReceiver fromType(String identity, Class<?> type) {
        if (!MessageReceiver.class.isAssignableFrom(type)) {
            throw new InvalidReceiverException(identity, type);
        }
        Class<? extends MessageReceiver> receiverType = type.asSubclass(MessageReceiver.class);

        Optional<? extends MessageReceiver> bean = beanContext.findBean(receiverType);
        if (bean.isPresent()) {
            log.debug("Resolved receiver {} from bean context", identity);
            return bean.get();
        }

        log.debug("Receiver {} is not a bean, instantiating", identity);
        return InstantiationUtils.tryInstantiate(receiverType)
                .orElseThrow(() -> new UnknownReceiverException(identity));
    }
}
