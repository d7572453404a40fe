package mytypist.cache.core.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A payload read from L2 together with the time it has left there.
 *
 * @param payload wire bytes (format tag + body)
 * @param remainingTtl time until L2 expires the key; {@code null} when the key has no deadline
 */
public record RemoteEntry(byte[] payload, Duration remainingTtl) {

  public RemoteEntry {
    Objects.requireNonNull(payload, "payload");
  }

  /** Remaining TTL capped at {@code max}; {@code max} itself when L2 reported no deadline. */
  public Duration ttlCappedAt(Duration max) {
    if (remainingTtl == null || remainingTtl.compareTo(max) > 0) {
      return max;
    }
    return remainingTtl;
  }
}
