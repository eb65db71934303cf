package com.acme.streamer.spi;

/**
 * Turns a receiver identity stored on a failed message back into a live receiver.
 */
public interface ReceiverResolver {

    /**
     * @param identity the receiver identity recorded when the message failed
     * @return a ready-to-use receiver
     * @throws com.acme.streamer.core.UnknownReceiverException if nothing is registered for it
     * @throws com.acme.streamer.core.InvalidReceiverException if the resolved object is not a
     *     {@link MessageReceiver}
     */
    MessageReceiver resolve(String identity);
}
