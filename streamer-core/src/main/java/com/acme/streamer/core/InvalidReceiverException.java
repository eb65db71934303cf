package com.acme.streamer.core;

/** The object resolved for a receiver identity does not implement MessageReceiver. */
public class InvalidReceiverException extends RuntimeException {
    private final String identity;

    public InvalidReceiverException(String identity, Class<?> resolvedType) {
        super(
                "Receiver class is not an instance of MessageReceiver contract: "
                        + identity
                        + " resolved to "
                        + resolvedType.getName());
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
