package com.acme.streamer.persistence.redis;

import com.acme.streamer.config.StreamerConfig;
import com.acme.streamer.core.Jsons;
import com.acme.streamer.domain.FailedMessage;
import com.acme.streamer.repository.FailedMessageRepository;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failed messages stored as JSON values of a Redis hash, one field per message id.
 *
 * <p>Removal reads the stored value and deletes the field only while it still holds that exact
 * value, so a replacement written between the read and the delete is kept.
 */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedisFailedMessageRepository implements FailedMessageRepository {
  private static final Logger LOG = LoggerFactory.getLogger(RedisFailedMessageRepository.class);

  private final RedissonClient redisson;
  private final StreamerConfig config;
  private final Clock clock;

  public RedisFailedMessageRepository(RedissonClient redisson, StreamerConfig config, Clock clock) {
    this.redisson = redisson;
    this.config = config;
    this.clock = clock;
  }

  private RMap<String, String> messages() {
    return redisson.getMap(config.getFailedMessagesKey(), StringCodec.INSTANCE);
  }

  @Override
  public FailedMessage add(FailedMessage message) {
    FailedMessage stored = message.withRecordedAt(clock.instant());
    messages().fastPut(stored.id(), Jsons.toJson(stored));
    LOG.debug(
        "Stored failed message id={} in {}", stored.id(), config.getFailedMessagesKey());
    return stored;
  }

  @Override
  public boolean remove(FailedMessage message) {
    RMap<String, String> map = messages();
    String json = map.get(message.id());
    if (json == null) {
      return false;
    }
    if (!decode(json).matches(message)) {
      LOG.debug("Kept failed message id={}: stored record was replaced", message.id());
      return false;
    }
    return map.remove(message.id(), json);
  }

  @Override
  public List<FailedMessage> all() {
    List<FailedMessage> snapshot = new ArrayList<>();
    for (String json : messages().readAllValues()) {
      snapshot.add(decode(json));
    }
    snapshot.sort(SNAPSHOT_ORDER);
    return snapshot;
  }

  @Override
  public Optional<FailedMessage> find(String id) {
    return Optional.ofNullable(messages().get(id)).map(RedisFailedMessageRepository::decode);
  }

  @Override
  public boolean exists(String id) {
    return messages().containsKey(id);
  }

  @Override
  public int count() {
    return messages().size();
  }

  @Override
  public int flush() {
    RMap<String, String> map = messages();
    Set<String> ids = map.readAllKeySet();
    if (ids.isEmpty()) {
      return 0;
    }
    long removed = map.fastRemove(ids.toArray(new String[0]));
    LOG.info("Flushed {} failed message(s) from {}", removed, config.getFailedMessagesKey());
    return (int) removed;
  }

  private static FailedMessage decode(String json) {
    return Jsons.fromJson(json, FailedMessage.class);
  }
}
