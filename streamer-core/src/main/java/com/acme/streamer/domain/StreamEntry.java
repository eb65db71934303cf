package com.acme.streamer.domain;

import java.util.Map;

/** Raw entry of a stream log: the log-assigned id and its field/value pairs. */
public record StreamEntry(String id, Map<String, String> content) {}
