package mytypist.cache.core.domain.model;

import java.util.Objects;
import mytypist.cache.error.exception.InvalidCacheArgumentException;

/**
 * Cache key (value object)
 *
 * <p>Fully qualified physical key: {@code prefix + namespace + ':' + key}, or {@code prefix + key}
 * when no namespace is given. Both tiers and the tag index only ever see this form.
 *
 * <p>A null or blank logical key is a caller error ({@link InvalidCacheArgumentException}).
 */
public record CacheKey(String value) {

  public CacheKey {
    Objects.requireNonNull(value, "CacheKey value cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("CacheKey value cannot be blank");
    }
  }

  public static CacheKey of(String prefix, String namespace, String key) {
    if (key == null || key.isBlank()) {
      throw new InvalidCacheArgumentException("key must not be null or blank");
    }
    String safePrefix = prefix == null ? "" : prefix;
    if (namespace == null || namespace.isEmpty()) {
      return new CacheKey(safePrefix + key);
    }
    return new CacheKey(safePrefix + namespace + ":" + key);
  }

  @Override
  public String toString() {
    return value;
  }
}
