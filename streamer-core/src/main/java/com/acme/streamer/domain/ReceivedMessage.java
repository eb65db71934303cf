package com.acme.streamer.domain;

import com.acme.streamer.core.Jsons;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stream entry as handed to a receiver for one processing attempt. Built fresh for every
 * delivery, including retries.
 */
public record ReceivedMessage(String id, Map<String, String> content) {
    public static final String NAME_FIELD = "name";
    public static final String DATA_FIELD = "data";

    public ReceivedMessage {
        Objects.requireNonNull(id, "id");
        content =
                content == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public static ReceivedMessage from(StreamEntry entry) {
        return new ReceivedMessage(entry.id(), entry.content());
    }

    /** Event name carried in the content, or an empty string when absent. */
    public String getEventName() {
        String name = content.get(NAME_FIELD);
        return name == null ? "" : name;
    }

    /** Decoded JSON payload of the {@code data} field; empty when the field is absent. */
    public Map<String, Object> getData() {
        return Jsons.toMap(content.get(DATA_FIELD));
    }
}
