package com.acme.streamer.spi;

import com.acme.streamer.domain.Range;
import com.acme.streamer.domain.StreamEntry;
import java.util.List;

/** Read access to the append-only stream log. */
public interface StreamReader {

    /**
     * Read entries of a stream whose ids fall in the inclusive range, oldest first.
     *
     * @param streamName logical stream name
     * @param range inclusive id range, possibly collapsed to a single id
     * @param limit maximum number of entries to return
     */
    List<StreamEntry> readRange(String streamName, Range range, int limit);
}
