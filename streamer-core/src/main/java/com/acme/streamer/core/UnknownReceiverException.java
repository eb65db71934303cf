package com.acme.streamer.core;

/** No receiver type, registration or bean exists for a receiver identity. */
public class UnknownReceiverException extends RuntimeException {
    private final String identity;

    public UnknownReceiverException(String identity) {
        super("Receiver class does not exist: " + identity);
        this.identity = identity;
    }

    public UnknownReceiverException(String identity, Throwable cause) {
        super("Receiver class does not exist: " + identity, cause);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
