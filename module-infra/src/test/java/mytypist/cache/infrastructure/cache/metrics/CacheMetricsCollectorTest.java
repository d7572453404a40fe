package mytypist.cache.infrastructure.cache.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import mytypist.cache.core.domain.model.CacheLayer;
import mytypist.cache.core.domain.model.CacheStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("CacheMetricsCollector")
class CacheMetricsCollectorTest {

  private MeterRegistry registry;
  private CacheMetricsCollector collector;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    collector = new CacheMetricsCollector(registry);
  }

  @Test
  @DisplayName("snapshot reflects hits per layer, misses and the mean latency")
  void snapshot() {
    collector.recordHit(CacheLayer.L1, 1_000_000);
    collector.recordHit(CacheLayer.L2, 3_000_000);
    collector.recordMiss(2_000_000);

    CacheStatistics stats = collector.snapshot(5);

    assertThat(stats.hitCount()).isEqualTo(2);
    assertThat(stats.l1HitCount()).isEqualTo(1);
    assertThat(stats.l2HitCount()).isEqualTo(1);
    assertThat(stats.missCount()).isEqualTo(1);
    assertThat(stats.totalRequests()).isEqualTo(3);
    assertThat(stats.averageLatencyMillis()).isEqualTo(2.0);
    assertThat(stats.hitRate()).isEqualTo(2.0 / 3.0);
    assertThat(stats.l1Size()).isEqualTo(5);
  }

  @Test
  @DisplayName("an empty collector reports zero rates instead of NaN")
  void empty() {
    CacheStatistics stats = collector.snapshot(0);

    assertThat(stats.hitRate()).isZero();
    assertThat(stats.averageLatencyMillis()).isZero();
  }

  @Test
  @DisplayName("Micrometer meters mirror the counters")
  void micrometerMeters() {
    collector.recordHit(CacheLayer.L1, 10);
    collector.recordHit(CacheLayer.L1, 10);
    collector.recordEviction();
    collector.recordL2Failure();
    collector.recordDecodeFailure();

    assertThat(registry.counter("cache.hit", "layer", "L1").count()).isEqualTo(2.0);
    assertThat(registry.counter("cache.hit", "layer", "L2").count()).isZero();
    assertThat(registry.counter("cache.eviction").count()).isEqualTo(1.0);
    assertThat(registry.counter("cache.l2.failure").count()).isEqualTo(1.0);
    assertThat(registry.counter("cache.decode.failure").count()).isEqualTo(1.0);
    assertThat(registry.timer("cache.get.latency").count()).isEqualTo(2);
  }

  @Test
  @DisplayName("the L1 size gauge reads the live size")
  void l1Gauge() {
    AtomicInteger size = new AtomicInteger(3);
    collector.bindL1Size(size::get);
    size.set(7);

    assertThat(registry.get("cache.l1.size").gauge().value()).isEqualTo(7.0);
  }
}
