package com.acme.streamer.config;

/**
 * Configuration for failed message storage and stream naming. Pure POJO - no framework
 * dependencies.
 */
public class StreamerConfig {

    private String failedMessagesKey = "failed_stream_messages";
    private String streamPrefix = "";

    public String getFailedMessagesKey() {
        return failedMessagesKey;
    }

    public void setFailedMessagesKey(String failedMessagesKey) {
        this.failedMessagesKey = failedMessagesKey;
    }

    public String getStreamPrefix() {
        return streamPrefix;
    }

    public void setStreamPrefix(String streamPrefix) {
        this.streamPrefix = streamPrefix == null ? "" : streamPrefix;
    }

    /** Build the storage key of a stream. Example: prefix "shop." and "order.created" -> shop.order.created */
    public String buildStreamKey(String streamName) {
        return streamPrefix + streamName;
    }
}
