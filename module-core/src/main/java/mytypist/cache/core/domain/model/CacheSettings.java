package mytypist.cache.core.domain.model;

import java.time.Duration;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable runtime settings of the cache, resolved once from configuration.
 *
 * @param keyPrefix process-wide prefix applied to every physical key
 * @param defaultTtl TTL used when a caller passes none
 * @param compressionThresholdBytes bodies strictly larger than this are gzipped
 * @param l1MaxEntries L1 capacity
 * @param l1Ttl upper bound on how long an entry may live in L1
 * @param tagTtlGrace how much longer a tag set outlives the members registered in it
 * @param batchChunkSize maximum keys per MGET or pipelined batch
 */
@Builder(toBuilder = true)
public record CacheSettings(
    String keyPrefix,
    Duration defaultTtl,
    int compressionThresholdBytes,
    int l1MaxEntries,
    Duration l1Ttl,
    Duration tagTtlGrace,
    int batchChunkSize) {

  public static final String DEFAULT_KEY_PREFIX = "mytypist:";

  public CacheSettings {
    Objects.requireNonNull(keyPrefix, "keyPrefix");
    requirePositive(defaultTtl, "defaultTtl");
    requirePositive(l1Ttl, "l1Ttl");
    Objects.requireNonNull(tagTtlGrace, "tagTtlGrace");
    if (compressionThresholdBytes < 0) {
      throw new IllegalArgumentException("compressionThresholdBytes must be >= 0");
    }
    if (l1MaxEntries < 1) {
      throw new IllegalArgumentException("l1MaxEntries must be >= 1");
    }
    if (batchChunkSize < 1) {
      throw new IllegalArgumentException("batchChunkSize must be >= 1");
    }
  }

  public static CacheSettings defaults() {
    return new CacheSettings(
        DEFAULT_KEY_PREFIX,
        Duration.ofSeconds(3600),
        1024,
        1000,
        Duration.ofSeconds(300),
        Duration.ofSeconds(60),
        500);
  }

  /** L1 keeps an entry for the shorter of the caller's TTL and the L1 cap. */
  public Duration l1TtlFor(Duration ttl) {
    return ttl.compareTo(l1Ttl) < 0 ? ttl : l1Ttl;
  }

  public Duration resolveTtl(Duration ttl) {
    return ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
  }

  private static void requirePositive(Duration d, String name) {
    Objects.requireNonNull(d, name);
    if (d.isZero() || d.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
