package mytypist.cache.core.domain.model;

/**
 * Read-only snapshot of the cache counters.
 *
 * <p>All counters are monotonic until restart. {@code averageLatencyMillis} is the running mean of
 * {@code get} latency over {@code totalRequests}.
 */
public record CacheStatistics(
    long hitCount,
    long missCount,
    long l1HitCount,
    long l2HitCount,
    long evictionCount,
    long totalRequests,
    long l2FailureCount,
    long decodeFailureCount,
    double averageLatencyMillis,
    int l1Size) {

  public double hitRate() {
    long lookups = hitCount + missCount;
    return lookups == 0 ? 0.0 : (double) hitCount / lookups;
  }
}
