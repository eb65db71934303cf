package com.acme.streamer.processor.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/** Redisson client for the failed message hash and the stream reads. */
@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(@Property(name = "redisson.address") String address) {
    Config config = new Config();
    config.useSingleServer().setAddress(address);
    return Redisson.create(config);
  }
}
