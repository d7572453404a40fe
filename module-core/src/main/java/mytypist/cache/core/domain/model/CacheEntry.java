package mytypist.cache.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** L1 entry. {@code expiresAt} is always {@code createdAt + ttl}. */
public record CacheEntry(EncodedValue value, Instant createdAt, Instant expiresAt) {

  public CacheEntry {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public static CacheEntry create(EncodedValue value, Instant now, Duration ttl) {
    return new CacheEntry(value, now, now.plus(ttl));
  }

  /** Expired once the clock reaches {@code expiresAt}. */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public Duration remaining(Instant now) {
    Duration left = Duration.between(now, expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }
}
