package com.acme.streamer.processor.config;

import com.acme.streamer.config.StreamerConfig;
import com.acme.streamer.dispatch.MessageDispatcher;
import com.acme.streamer.failure.FailedMessagesHandler;
import com.acme.streamer.failure.MessagesFailer;
import com.acme.streamer.receiver.ReceiverRegistry;
import com.acme.streamer.repository.FailedMessageRepository;
import com.acme.streamer.repository.InMemoryFailedMessageRepository;
import com.acme.streamer.spi.ReceiverResolver;
import com.acme.streamer.spi.StreamReader;
import com.acme.streamer.stream.InMemoryStreamReader;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for the framework-free core beans.
 *
 * <p>The core module has no framework dependencies; this factory binds its POJOs to Micronaut
 * configuration and wires them together. Redis-backed repository and stream reader beans come
 * from the persistence module when a {@code RedissonClient} exists; with {@code
 * redisson.enabled=false} both are held in process memory instead.
 */
@Factory
public class CoreBeansFactory {

  /** Creates StreamerConfig populated from application.yml streamer.* properties */
  @Singleton
  public StreamerConfig streamerConfig(
      @Value("${streamer.failed-messages-key:failed_stream_messages}") String failedMessagesKey,
      @Value("${streamer.stream-prefix:}") String streamPrefix) {
    StreamerConfig config = new StreamerConfig();
    config.setFailedMessagesKey(failedMessagesKey);
    config.setStreamPrefix(streamPrefix);
    return config;
  }

  /** Wall clock used to stamp failed messages */
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public ReceiverRegistry receiverRegistry() {
    return new ReceiverRegistry();
  }

  /** Process-local repository, used when Redis is switched off */
  @Singleton
  @Requires(property = "redisson.enabled", value = "false")
  public FailedMessageRepository inMemoryFailedMessageRepository(Clock clock) {
    return new InMemoryFailedMessageRepository(clock);
  }

  /** Process-local stream log, the point-read source for retries when Redis is switched off */
  @Singleton
  @Requires(property = "redisson.enabled", value = "false")
  public InMemoryStreamReader inMemoryStreamReader() {
    return new InMemoryStreamReader();
  }

  @Singleton
  public MessagesFailer messagesFailer(
      FailedMessageRepository repository, ReceiverResolver receiverResolver, StreamReader streamReader) {
    return new FailedMessagesHandler(repository, receiverResolver, streamReader);
  }

  @Singleton
  public MessageDispatcher messageDispatcher(MessagesFailer messagesFailer) {
    return new MessageDispatcher(messagesFailer);
  }
}
