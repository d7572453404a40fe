package mytypist.cache.config;

import lombok.extern.slf4j.Slf4j;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single-server Redisson client for L2, tag sets and the invalidation topic.
 *
 * <p>An unreachable Redis at startup does not fail the context: the bean resolves to {@code null}
 * and the cache runs L1-only (see {@link CacheServiceConfig}).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(
    name = "mytypist.cache.backing-store.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RedissonConfig {

  private static final int RETRY_ATTEMPTS = 3;
  private static final int RETRY_INTERVAL_MILLIS = 1500;

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient(CacheProperties properties, LogicExecutor executor) {
    CacheProperties.BackingStore store = properties.getBackingStore();
    return executor.executeOrCatch(
        () -> Redisson.create(clientConfig(store)),
        e -> {
          log.warn(
              "[RedissonConfig] Redis unreachable at {}, cache starts L1-only: {}",
              store.getUrl(),
              e.getMessage());
          return null;
        },
        TaskContext.of("RedissonConfig", "Create", store.getUrl()));
  }

  static Config clientConfig(CacheProperties.BackingStore store) {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(store.getUrl())
        .setRetryAttempts(RETRY_ATTEMPTS)
        .setRetryInterval(RETRY_INTERVAL_MILLIS)
        .setTimeout(store.getTimeoutMillis())
        .setConnectTimeout(store.getConnectTimeoutMillis());
    return config;
  }
}
