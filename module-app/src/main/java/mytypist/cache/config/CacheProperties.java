package mytypist.cache.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import mytypist.cache.core.domain.model.CacheSettings;
import mytypist.cache.infrastructure.serialization.JacksonCacheSerializer;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External settings of the tiered cache, bound from {@code mytypist.cache.*}.
 *
 * <h4>Defaults</h4>
 *
 * <ul>
 *   <li>TTL 1h when the caller passes none, L1 capped at 5 minutes and 1000 entries
 *   <li>values over 1 KiB are gzipped
 *   <li>tag sets outlive their longest member by 60s
 *   <li>JDK payloads are read only for {@code java.base} and {@code mytypist.**} classes
 * </ul>
 *
 * @see CacheServiceConfig
 */
@Validated
@ConfigurationProperties(prefix = "mytypist.cache")
public class CacheProperties {

  @NotNull @Valid private BackingStore backingStore = new BackingStore();

  @NotNull @Valid private Invalidation invalidation = new Invalidation();

  @Min(1)
  private long defaultTtlSeconds = 3600;

  @Min(0)
  private int compressionThresholdBytes = 1024;

  @Min(1)
  @Max(1_000_000)
  private int l1MaxEntries = 1000;

  @Min(1)
  private long l1TtlSeconds = 300;

  @NotNull private String keyPrefix = CacheSettings.DEFAULT_KEY_PREFIX;

  @Min(0)
  private long tagTtlGraceSeconds = 60;

  @NotBlank private String instanceId = "local";

  /** {@code ObjectInputFilter} pattern for JDK payloads read back from either tier. */
  @NotBlank
  private String deserializationFilter = JacksonCacheSerializer.DEFAULT_DESERIALIZATION_FILTER;

  public CacheSettings toSettings() {
    return CacheSettings.builder()
        .keyPrefix(keyPrefix)
        .defaultTtl(Duration.ofSeconds(defaultTtlSeconds))
        .compressionThresholdBytes(compressionThresholdBytes)
        .l1MaxEntries(l1MaxEntries)
        .l1Ttl(Duration.ofSeconds(l1TtlSeconds))
        .tagTtlGrace(Duration.ofSeconds(tagTtlGraceSeconds))
        .batchChunkSize(backingStore.getBatchChunkSize())
        .build();
  }

  public BackingStore getBackingStore() {
    return backingStore;
  }

  public void setBackingStore(BackingStore backingStore) {
    this.backingStore = backingStore;
  }

  public Invalidation getInvalidation() {
    return invalidation;
  }

  public void setInvalidation(Invalidation invalidation) {
    this.invalidation = invalidation;
  }

  public long getDefaultTtlSeconds() {
    return defaultTtlSeconds;
  }

  public void setDefaultTtlSeconds(long defaultTtlSeconds) {
    this.defaultTtlSeconds = defaultTtlSeconds;
  }

  public int getCompressionThresholdBytes() {
    return compressionThresholdBytes;
  }

  public void setCompressionThresholdBytes(int compressionThresholdBytes) {
    this.compressionThresholdBytes = compressionThresholdBytes;
  }

  public int getL1MaxEntries() {
    return l1MaxEntries;
  }

  public void setL1MaxEntries(int l1MaxEntries) {
    this.l1MaxEntries = l1MaxEntries;
  }

  public long getL1TtlSeconds() {
    return l1TtlSeconds;
  }

  public void setL1TtlSeconds(long l1TtlSeconds) {
    this.l1TtlSeconds = l1TtlSeconds;
  }

  public String getDeserializationFilter() {
    return deserializationFilter;
  }

  public void setDeserializationFilter(String deserializationFilter) {
    this.deserializationFilter = deserializationFilter;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public long getTagTtlGraceSeconds() {
    return tagTtlGraceSeconds;
  }

  public void setTagTtlGraceSeconds(long tagTtlGraceSeconds) {
    this.tagTtlGraceSeconds = tagTtlGraceSeconds;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public void setInstanceId(String instanceId) {
    this.instanceId = instanceId;
  }

  /** Redis connection. {@code enabled=false} runs the cache L1-only. */
  public static class BackingStore {

    @NotBlank private String url = "redis://localhost:6379";

    private boolean enabled = true;

    @Min(1)
    private int timeoutMillis = 3000;

    @Min(1)
    private int connectTimeoutMillis = 5000;

    @Min(1)
    @Max(10_000)
    private int batchChunkSize = 500;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getTimeoutMillis() {
      return timeoutMillis;
    }

    public void setTimeoutMillis(int timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }

    public int getConnectTimeoutMillis() {
      return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getBatchChunkSize() {
      return batchChunkSize;
    }

    public void setBatchChunkSize(int batchChunkSize) {
      this.batchChunkSize = batchChunkSize;
    }
  }

  /** Cross-instance L1 invalidation over Redis pub/sub. */
  public static class Invalidation {

    private boolean broadcastEnabled = true;

    @NotBlank private String topic = "mytypist:cache:invalidation";

    public boolean isBroadcastEnabled() {
      return broadcastEnabled;
    }

    public void setBroadcastEnabled(boolean broadcastEnabled) {
      this.broadcastEnabled = broadcastEnabled;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }
  }
}
