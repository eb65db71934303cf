package com.acme.streamer.processor.config;

import com.acme.streamer.config.StreamerConfig;
import com.acme.streamer.receiver.ReceiverRegistry;
import com.acme.streamer.repository.FailedMessageRepository;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final StreamerConfig streamerConfig;
    private final FailedMessageRepository repository;
    private final ReceiverRegistry registry;

    @Value("${redisson.enabled:true}")
    private boolean redissonEnabled;

    @Value("${redisson.address:}")
    private String redissonAddress;

    public ConfigurationLogger(
            StreamerConfig streamerConfig, FailedMessageRepository repository, ReceiverRegistry registry) {
        this.streamerConfig = streamerConfig;
        this.repository = repository;
        this.registry = registry;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("━━━ Redis Configuration ━━━");
        LOG.info("  Enabled:            {} (false keeps failures in process memory)", redissonEnabled);
        LOG.info("  Address:            {}", redissonAddress);
        LOG.info("");

        LOG.info("━━━ Failed Messages ━━━");
        LOG.info("  Hash Key:           {} (Redis hash holding one record per message id)", streamerConfig.getFailedMessagesKey());
        LOG.info("  Stream Prefix:      '{}' (prepended to event names to build stream keys)", streamerConfig.getStreamPrefix());
        LOG.info("  Repository:         {}", repository.getClass().getSimpleName());
        LOG.info("  Outstanding:        {}", repository.count());
        LOG.info("  Registered Keys:    {}", registry.identities());
    }
}
