package mytypist.cache.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.core.port.out.CacheSerializer;
import mytypist.cache.core.port.out.RemoteStore;
import mytypist.cache.infrastructure.cache.CacheService;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.redis.DisabledRemoteStore;
import mytypist.cache.infrastructure.redis.RedissonRemoteStore;
import mytypist.cache.infrastructure.serialization.JacksonCacheSerializer;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the single {@link CacheService} instance.
 *
 * <pre>
 * RedissonClient present -> RedissonRemoteStore
 * otherwise              -> DisabledRemoteStore (L1-only)
 * </pre>
 */
@Slf4j
@Configuration
public class CacheServiceConfig {

  @Bean
  public CacheSerializer cacheSerializer(CacheProperties properties, LogicExecutor executor) {
    return new JacksonCacheSerializer(
        executor,
        properties.getCompressionThresholdBytes(),
        properties.getDeserializationFilter());
  }

  @Bean
  public RemoteStore remoteStore(
      ObjectProvider<RedissonClient> redissonClient,
      CacheProperties properties,
      LogicExecutor executor) {
    RedissonClient client = redissonClient.getIfAvailable();
    if (client == null) {
      log.warn("[CacheServiceConfig] No Redis client, using DisabledRemoteStore");
      return new DisabledRemoteStore();
    }
    return new RedissonRemoteStore(
        client, executor, properties.getBackingStore().getBatchChunkSize());
  }

  @Bean(initMethod = "init", destroyMethod = "shutdown")
  public CacheService cacheService(
      CacheProperties properties,
      RemoteStore remoteStore,
      CacheSerializer cacheSerializer,
      LogicExecutor executor,
      ObjectProvider<MeterRegistry> meterRegistry,
      ObjectProvider<CacheInvalidationPublisher> invalidationPublisher,
      ObjectProvider<CacheInvalidationSubscriber> invalidationSubscriber) {
    return CacheService.builder()
        .settings(properties.toSettings())
        .remoteStore(remoteStore)
        .serializer(cacheSerializer)
        .executor(executor)
        .meterRegistry(meterRegistry.getIfAvailable())
        .invalidationPublisher(invalidationPublisher.getIfAvailable())
        .invalidationSubscriber(invalidationSubscriber.getIfAvailable())
        .instanceId(properties.getInstanceId())
        .build();
  }
}
