package mytypist.cache.infrastructure.cache.invalidation.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * {@link CacheInvalidationSubscriber} on a Redisson {@link RTopic}.
 *
 * <p>Self-skip: events carrying this instance's id are dropped, the publisher already applied them
 * locally.
 */
@Slf4j
public class RedisCacheInvalidationSubscriber implements CacheInvalidationSubscriber {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final String instanceId;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  private volatile RTopic topic;
  private volatile Integer listenerId;
  private volatile Consumer<CacheInvalidationEvent> handler;

  public RedisCacheInvalidationSubscriber(
      RedissonClient redissonClient,
      String topicName,
      String instanceId,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.redissonClient = redissonClient;
    this.topicName = topicName;
    this.instanceId = instanceId;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void subscribe(Consumer<CacheInvalidationEvent> handler) {
    this.handler = handler;
    TaskContext context = TaskContext.of("CacheInvalidation", "Subscribe", instanceId);

    boolean subscribed =
        executor.executeOrDefault(
            () -> {
              topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
              listenerId =
                  topic.addListener(String.class, (channel, message) -> onMessage(message));
              return true;
            },
            false,
            context);

    if (subscribed) {
      log.info(
          "[CacheInvalidation] Subscribed to topic: {}, instanceId={}", topicName, instanceId);
    } else {
      log.warn(
          "[CacheInvalidation] Subscribe failed, L1 copies now rely on TTL: topic={}",
          topicName);
    }
  }

  /** Raw topic callback. */
  void onMessage(String message) {
    CacheInvalidationEvent event =
        executor.executeOrDefault(
            () -> objectMapper.readValue(message, CacheInvalidationEvent.class),
            null,
            TaskContext.of("CacheInvalidation", "Decode"));
    if (event == null) {
      log.warn("[CacheInvalidation] Dropped undecodable message on {}", topicName);
      return;
    }
    onEvent(event);
  }

  public void onEvent(CacheInvalidationEvent event) {
    if (instanceId.equals(event.sourceInstanceId())) {
      log.trace("[CacheInvalidation] Self-skip: type={}", event.type());
      return;
    }
    Consumer<CacheInvalidationEvent> current = handler;
    if (current == null) {
      return;
    }

    executor.executeOrDefault(
        () -> {
          current.accept(event);
          return true;
        },
        false,
        TaskContext.of("CacheInvalidation", "OnEvent", event.type().name()));
    meterRegistry.counter("cache.invalidation.received", "type", event.type().name()).increment();
  }

  @Override
  public void unsubscribe() {
    TaskContext context = TaskContext.of("CacheInvalidation", "Unsubscribe", instanceId);

    executor.executeOrDefault(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[CacheInvalidation] Unsubscribed from topic: instanceId={}", instanceId);
          }
          return true;
        },
        false,
        context);
    handler = null;
  }
}
