package mytypist.cache.infrastructure.cache.invalidation.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * {@link CacheInvalidationPublisher} on a Redisson {@link RTopic}.
 *
 * <p>Events travel as JSON strings so every instance decodes them regardless of its Redisson codec
 * defaults. A Redis failure only costs the broadcast; the caller's invalidation already happened.
 */
@Slf4j
public class RedisCacheInvalidationPublisher implements CacheInvalidationPublisher {

  private final LogicExecutor executor;
  private final ObjectMapper objectMapper;
  private final RTopic topic;
  private final Counter successCounter;
  private final Counter failureCounter;

  public RedisCacheInvalidationPublisher(
      RedissonClient redissonClient,
      String topicName,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.objectMapper = objectMapper;
    this.topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
    this.successCounter =
        Counter.builder("cache.invalidation.publish")
            .tag("status", "success")
            .register(meterRegistry);
    this.failureCounter =
        Counter.builder("cache.invalidation.publish")
            .tag("status", "failure")
            .register(meterRegistry);
  }

  @Override
  public void publish(CacheInvalidationEvent event) {
    TaskContext context = TaskContext.of("CacheInvalidation", "Publish", event.type().name());

    long clientsReceived =
        executor.executeOrDefault(
            () -> topic.publish(objectMapper.writeValueAsString(event)), -1L, context);

    recordPublishResult(clientsReceived, event);
  }

  private void recordPublishResult(long clientsReceived, CacheInvalidationEvent event) {
    if (clientsReceived < 0) {
      failureCounter.increment();
      log.warn(
          "[CacheInvalidation] Publish failed, remote L1 copies expire by TTL: type={}, keys={}",
          event.type(),
          event.keys().size());
      return;
    }
    successCounter.increment();
    log.debug(
        "[CacheInvalidation] Published: type={}, keys={}, clients={}",
        event.type(),
        event.keys().size(),
        clientsReceived);
  }
}
