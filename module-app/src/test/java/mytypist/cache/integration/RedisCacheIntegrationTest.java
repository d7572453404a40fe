package mytypist.cache.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import mytypist.cache.MyTypistCacheApplication;
import mytypist.cache.config.CacheProperties;
import mytypist.cache.infrastructure.cache.CacheService;
import mytypist.cache.infrastructure.cache.invalidation.impl.RedisCacheInvalidationSubscriber;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.redis.RedissonRemoteStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(classes = MyTypistCacheApplication.class)
@DisplayName("CacheService against a real Redis")
class RedisCacheIntegrationTest {

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  @DynamicPropertySource
  static void redisProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "mytypist.cache.backing-store.url",
        () -> "redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379));
    registry.add("mytypist.cache.instance-id", () -> "node-1");
  }

  @Autowired private CacheService cacheService;
  @Autowired private RedissonClient redissonClient;
  @Autowired private CacheProperties properties;
  @Autowired private LogicExecutor executor;

  @AfterEach
  void tearDown() {
    redissonClient.getKeys().flushdb();
    cacheService.clearLocal();
  }

  @Test
  @DisplayName("an entry written here is read back from Redis once L1 is cleared")
  void l2RoundTrip() {
    Map<String, Object> user = Map.of("name", "Alice", "age", 30);
    cacheService.set("user:1", user, Duration.ofMinutes(5));
    cacheService.clearLocal();

    assertThat(cacheService.get("user:1")).contains(user);
    assertThat(cacheService.statistics().l2HitCount()).isPositive();
  }

  @Test
  @DisplayName("tag invalidation deletes the Redis keys and the tag set")
  void tagInvalidation() {
    cacheService.set("a", 1, Duration.ofMinutes(5), List.of("templates"));
    cacheService.set("b", 2, Duration.ofMinutes(5), List.of("templates"));

    assertThat(cacheService.invalidateByTag("templates")).isEqualTo(2);
    assertThat(redissonClient.getBucket("mytypist:a").isExists()).isFalse();
    assertThat(redissonClient.getSet("mytypist:tag:templates", StringCodec.INSTANCE).isExists())
        .isFalse();
  }

  @Test
  @DisplayName("tag sets outlive their members")
  void tagSetTtl() {
    cacheService.set("a", 1, Duration.ofSeconds(30), List.of("t"));

    long setTtl = redissonClient.getSet("mytypist:tag:t", StringCodec.INSTANCE).remainTimeToLive();
    long valueTtl = redissonClient.getBucket("mytypist:a").remainTimeToLive();
    assertThat(setTtl).isGreaterThan(valueTtl);
  }

  @Test
  @DisplayName("entries expire from Redis after their TTL")
  void expiry() {
    cacheService.set("short", "v", Duration.ofSeconds(1));

    await()
        .atMost(Duration.ofSeconds(5))
        .untilAsserted(() -> assertThat(cacheService.get("short")).isEmpty());
  }

  @Test
  @DisplayName("a write on one node evicts the stale L1 copy on another")
  void crossInstanceInvalidation() {
    CacheService other =
        CacheService.builder()
            .settings(properties.toSettings())
            .remoteStore(new RedissonRemoteStore(redissonClient, executor, 500))
            .executor(executor)
            .invalidationSubscriber(
                new RedisCacheInvalidationSubscriber(
                    redissonClient,
                    properties.getInvalidation().getTopic(),
                    "node-2",
                    new ObjectMapper(),
                    executor,
                    new SimpleMeterRegistry()))
            .instanceId("node-2")
            .build();
    other.init();
    try {
      cacheService.set("k", "v1", Duration.ofMinutes(5));
      assertThat(other.get("k")).contains("v1");

      cacheService.set("k", "v2", Duration.ofMinutes(5));

      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(() -> assertThat(other.get("k")).contains("v2"));
    } finally {
      other.shutdown();
    }
  }
}
