package mytypist.cache.infrastructure.cache.invalidation.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import mytypist.cache.infrastructure.cache.invalidation.InvalidationType;
import mytypist.cache.support.TestLogicExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.Codec;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RedisCacheInvalidationSubscriber")
@Tag("unit")
class RedisCacheInvalidationSubscriberTest {

  private static final String TOPIC = "mytypist:cache:invalidation";

  @Mock private RedissonClient redissonClient;
  @Mock private RTopic topic;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<CacheInvalidationEvent> received = new CopyOnWriteArrayList<>();
  private MeterRegistry meterRegistry;
  private RedisCacheInvalidationSubscriber subscriber;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    when(redissonClient.getTopic(eq(TOPIC), any(Codec.class))).thenReturn(topic);
    when(topic.addListener(eq(String.class), any())).thenReturn(42);
    subscriber =
        new RedisCacheInvalidationSubscriber(
            redissonClient,
            TOPIC,
            "node-a",
            objectMapper,
            TestLogicExecutors.passThrough(),
            meterRegistry);
    subscriber.subscribe(received::add);
  }

  @Test
  @DisplayName("delivers JSON events from other instances to the handler")
  @SuppressWarnings("unchecked")
  void deliversRemoteEvents() throws Exception {
    ArgumentCaptor<MessageListener<String>> listener =
        ArgumentCaptor.forClass(MessageListener.class);
    verify(topic).addListener(eq(String.class), listener.capture());
    String json =
        objectMapper.writeValueAsString(
            CacheInvalidationEvent.evict(List.of("mytypist:k"), "node-b"));

    listener.getValue().onMessage(TOPIC, json);

    assertThat(received).singleElement().satisfies(
        event -> {
          assertThat(event.keys()).containsExactly("mytypist:k");
          assertThat(event.type()).isEqualTo(InvalidationType.EVICT);
        });
    assertThat(meterRegistry.counter("cache.invalidation.received", "type", "EVICT").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("skips events this instance published")
  void selfSkip() {
    subscriber.onEvent(CacheInvalidationEvent.evict(List.of("mytypist:k"), "node-a"));

    assertThat(received).isEmpty();
  }

  @Test
  @DisplayName("drops undecodable messages without failing the listener")
  void undecodable() {
    subscriber.onMessage("{not json");

    assertThat(received).isEmpty();
  }

  @Test
  @DisplayName("unsubscribe removes the listener and stops delivery")
  void unsubscribe() {
    subscriber.unsubscribe();
    subscriber.onEvent(CacheInvalidationEvent.clearAll("node-b"));

    verify(topic).removeListener(42);
    assertThat(received).isEmpty();
  }
}
