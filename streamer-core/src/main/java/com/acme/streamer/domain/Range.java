package com.acme.streamer.domain;

import java.util.Objects;

/** Inclusive range of stream ids. */
public record Range(String start, String end) {
    public static final String FIRST = "-";
    public static final String LAST = "+";

    public Range {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /** Range collapsed to a single id. */
    public static Range single(String id) {
        return new Range(id, id);
    }

    public static Range all() {
        return new Range(FIRST, LAST);
    }
}
