package mytypist.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import mytypist.cache.infrastructure.cache.invalidation.impl.RedisCacheInvalidationPublisher;
import mytypist.cache.infrastructure.cache.invalidation.impl.RedisCacheInvalidationSubscriber;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-instance L1 invalidation over a Redis topic.
 *
 * <p>Active when {@code mytypist.cache.invalidation.broadcast-enabled=true} (default). Without a
 * Redis client both beans are no-ops; each instance's L1 TTL then bounds staleness.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(
    name = "mytypist.cache.invalidation.broadcast-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CacheInvalidationConfig {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Bean
  public CacheInvalidationPublisher cacheInvalidationPublisher(
      ObjectProvider<RedissonClient> redissonClient,
      CacheProperties properties,
      LogicExecutor executor,
      ObjectProvider<MeterRegistry> meterRegistry) {
    RedissonClient client = redissonClient.getIfAvailable();
    if (client == null) {
      log.info("[CacheInvalidationConfig] No Redis client, invalidation broadcast disabled");
      return CacheInvalidationPublisher.NO_OP;
    }
    return new RedisCacheInvalidationPublisher(
        client,
        properties.getInvalidation().getTopic(),
        objectMapper,
        executor,
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public CacheInvalidationSubscriber cacheInvalidationSubscriber(
      ObjectProvider<RedissonClient> redissonClient,
      CacheProperties properties,
      LogicExecutor executor,
      ObjectProvider<MeterRegistry> meterRegistry) {
    RedissonClient client = redissonClient.getIfAvailable();
    if (client == null) {
      return CacheInvalidationSubscriber.NO_OP;
    }
    return new RedisCacheInvalidationSubscriber(
        client,
        properties.getInvalidation().getTopic(),
        properties.getInstanceId(),
        objectMapper,
        executor,
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }
}
