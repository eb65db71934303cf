package com.acme.streamer.receiver;

/** Helpers for receiver identities. */
public final class Receivers {
    private static final String INTERCEPTED_SUFFIX = "$Intercepted";

    private Receivers() {}

    /**
     * Stable identity of a live receiver: its class name, with the suffix of a generated AOP proxy
     * removed so the identity names the class the proxy wraps.
     */
    public static String identityOf(Object receiver) {
        return identityOf(receiver.getClass());
    }

    public static String identityOf(Class<?> receiverType) {
        String name = receiverType.getName();
        int proxyIdx = name.indexOf(INTERCEPTED_SUFFIX);
        return proxyIdx > 0 ? name.substring(0, proxyIdx) : name;
    }
}
