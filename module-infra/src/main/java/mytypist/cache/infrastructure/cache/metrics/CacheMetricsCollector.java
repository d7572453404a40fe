package mytypist.cache.infrastructure.cache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;
import mytypist.cache.core.domain.model.CacheLayer;
import mytypist.cache.core.domain.model.CacheStatistics;

/**
 * Cache counters, kept twice: {@link LongAdder}s for the read-only {@link CacheStatistics}
 * snapshot, Micrometer meters for export.
 *
 * <p>Counters are pre-registered so the hot path never allocates a meter.
 */
public class CacheMetricsCollector {

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder l1Hits = new LongAdder();
  private final LongAdder l2Hits = new LongAdder();
  private final LongAdder evictions = new LongAdder();
  private final LongAdder requests = new LongAdder();
  private final LongAdder l2Failures = new LongAdder();
  private final LongAdder decodeFailures = new LongAdder();
  private final LongAdder latencyNanos = new LongAdder();

  private final MeterRegistry meterRegistry;
  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;
  private final Counter evictionCounter;
  private final Counter l2FailureCounter;
  private final Counter decodeFailureCounter;
  private final Timer getLatency;

  public CacheMetricsCollector(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.l1HitCounter =
        Counter.builder("cache.hit").tag("layer", CacheLayer.L1.tagValue()).register(meterRegistry);
    this.l2HitCounter =
        Counter.builder("cache.hit").tag("layer", CacheLayer.L2.tagValue()).register(meterRegistry);
    this.missCounter = Counter.builder("cache.miss").register(meterRegistry);
    this.evictionCounter =
        Counter.builder("cache.eviction")
            .description("L1 entries dropped by LRU")
            .register(meterRegistry);
    this.l2FailureCounter =
        Counter.builder("cache.l2.failure")
            .description("Backing store calls that degraded")
            .register(meterRegistry);
    this.decodeFailureCounter = Counter.builder("cache.decode.failure").register(meterRegistry);
    this.getLatency =
        Timer.builder("cache.get.latency")
            .description("Cache lookup latency")
            .register(meterRegistry);
  }

  /** Exposes the current L1 size as the {@code cache.l1.size} gauge. */
  public void bindL1Size(IntSupplier l1Size) {
    Gauge.builder("cache.l1.size", l1Size, IntSupplier::getAsInt)
        .strongReference(true)
        .register(meterRegistry);
  }

  public void recordHit(CacheLayer layer, long elapsedNanos) {
    hits.increment();
    if (layer == CacheLayer.L1) {
      l1Hits.increment();
      l1HitCounter.increment();
    } else {
      l2Hits.increment();
      l2HitCounter.increment();
    }
    recordLatency(elapsedNanos);
  }

  public void recordMiss(long elapsedNanos) {
    misses.increment();
    missCounter.increment();
    recordLatency(elapsedNanos);
  }

  public void recordEviction() {
    evictions.increment();
    evictionCounter.increment();
  }

  public void recordL2Failure() {
    l2Failures.increment();
    l2FailureCounter.increment();
  }

  public void recordDecodeFailure() {
    decodeFailures.increment();
    decodeFailureCounter.increment();
  }

  public CacheStatistics snapshot(int l1Size) {
    long total = requests.sum();
    double averageMillis = total == 0 ? 0.0 : latencyNanos.sum() / (double) total / 1_000_000.0;
    return new CacheStatistics(
        hits.sum(),
        misses.sum(),
        l1Hits.sum(),
        l2Hits.sum(),
        evictions.sum(),
        total,
        l2Failures.sum(),
        decodeFailures.sum(),
        averageMillis,
        l1Size);
  }

  private void recordLatency(long elapsedNanos) {
    long nanos = Math.max(0L, elapsedNanos);
    requests.increment();
    latencyNanos.add(nanos);
    getLatency.record(nanos, TimeUnit.NANOSECONDS);
  }
}
