package com.acme.streamer.processor.receiver;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Subscribes a {@code MessageReceiver} bean to the named events.
 *
 * <pre>
 * {@literal @}Singleton
 * {@literal @}Listens("order.created")
 * public class OrderProjection implements MessageReceiver { ... }
 * </pre>
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Listens {
    /** Event names, matched against the {@code name} field of stream messages. */
    String[] value();
}
