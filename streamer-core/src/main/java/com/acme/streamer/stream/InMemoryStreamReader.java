package com.acme.streamer.stream;

import com.acme.streamer.domain.Range;
import com.acme.streamer.domain.StreamEntry;
import com.acme.streamer.spi.StreamReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local stream log for tests and single-node deployments without Redis.
 *
 * <p>Ids of the form {@code <millis>-<sequence>} are ordered numerically, anything else falls back
 * to string order.
 */
public class InMemoryStreamReader implements StreamReader {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStreamReader.class);

    static final Comparator<String> ID_ORDER = (a, b) -> {
        long[] left = parse(a);
        long[] right = parse(b);
        if (left == null || right == null) {
            return a.compareTo(b);
        }
        int byMillis = Long.compare(left[0], right[0]);
        return byMillis != 0 ? byMillis : Long.compare(left[1], right[1]);
    };

    private final Map<String, NavigableMap<String, Map<String, String>>> streams = new ConcurrentHashMap<>();

    public InMemoryStreamReader append(String stream, String id, Map<String, String> content) {
        streams.computeIfAbsent(stream, k -> new ConcurrentSkipListMap<>(ID_ORDER)).put(id, Map.copyOf(content));
        LOG.debug("Appended entry id={} to stream={}", id, stream);
        return this;
    }

    /** Drops a single entry, as retention trimming would. */
    public InMemoryStreamReader trim(String stream, String id) {
        NavigableMap<String, Map<String, String>> entries = streams.get(stream);
        if (entries != null) {
            entries.remove(id);
        }
        return this;
    }

    @Override
    public List<StreamEntry> readRange(String streamName, Range range, int limit) {
        NavigableMap<String, Map<String, String>> entries = streams.get(streamName);
        List<StreamEntry> result = new ArrayList<>();
        if (entries == null || limit <= 0) {
            return result;
        }
        for (Map.Entry<String, Map<String, String>> e : entries.entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            if (inRange(e.getKey(), range)) {
                result.add(new StreamEntry(e.getKey(), e.getValue()));
            }
        }
        return result;
    }

    private static boolean inRange(String id, Range range) {
        boolean afterStart = Range.FIRST.equals(range.start()) || ID_ORDER.compare(id, range.start()) >= 0;
        boolean beforeEnd = Range.LAST.equals(range.end()) || ID_ORDER.compare(id, range.end()) <= 0;
        return afterStart && beforeEnd;
    }

    private static long[] parse(String id) {
        int dash = id.indexOf('-');
        try {
            if (dash < 0) {
                return new long[] {Long.parseLong(id), 0L};
            }
            return new long[] {Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1))};
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
