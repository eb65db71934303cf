package com.acme.streamer.persistence.redis;

import com.acme.streamer.config.StreamerConfig;
import com.acme.streamer.domain.Range;
import com.acme.streamer.domain.StreamEntry;
import com.acme.streamer.spi.StreamReader;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.api.StreamMessageId;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads entries of Redis streams by id range ({@code XRANGE}). */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedisStreamReader implements StreamReader {
  private static final Logger LOG = LoggerFactory.getLogger(RedisStreamReader.class);

  private final RedissonClient redisson;
  private final StreamerConfig config;

  public RedisStreamReader(RedissonClient redisson, StreamerConfig config) {
    this.redisson = redisson;
    this.config = config;
  }

  @Override
  public List<StreamEntry> readRange(String streamName, Range range, int limit) {
    Optional<StreamMessageId> start = StreamIds.parse(range.start());
    Optional<StreamMessageId> end = StreamIds.parse(range.end());
    if (start.isEmpty() || end.isEmpty()) {
      // no entry of a Redis stream can carry such an id
      LOG.warn("Invalid stream id range {}..{} on {}", range.start(), range.end(), streamName);
      return List.of();
    }

    String key = config.buildStreamKey(streamName);
    RStream<String, String> stream = redisson.getStream(key, StringCodec.INSTANCE);
    Map<StreamMessageId, Map<String, String>> entries = stream.range(limit, start.get(), end.get());

    List<StreamEntry> result = new ArrayList<>(entries.size());
    for (Map.Entry<StreamMessageId, Map<String, String>> entry : entries.entrySet()) {
      result.add(
          new StreamEntry(StreamIds.format(entry.getKey()), new LinkedHashMap<>(entry.getValue())));
    }
    LOG.debug("Read {} entr(ies) from {} in {}..{}", result.size(), key, range.start(), range.end());
    return result;
  }
}
