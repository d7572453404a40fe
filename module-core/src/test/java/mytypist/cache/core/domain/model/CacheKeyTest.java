package mytypist.cache.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import mytypist.cache.error.exception.InvalidCacheArgumentException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheKeyTest {

  @Test
  void namespacedKey() {
    assertThat(CacheKey.of("mytypist:", "template", "42").value())
        .isEqualTo("mytypist:template:42");
  }

  @Test
  void keyWithoutNamespaceStillCarriesPrefix() {
    assertThat(CacheKey.of("mytypist:", "", "user:1").value()).isEqualTo("mytypist:user:1");
    assertThat(CacheKey.of("mytypist:", null, "user:1").value()).isEqualTo("mytypist:user:1");
  }

  @Test
  void blankKeyRejected() {
    assertThatThrownBy(() -> CacheKey.of("p:", "ns", " "))
        .isInstanceOf(InvalidCacheArgumentException.class)
        .hasMessageContaining("blank");
  }

  @Test
  void settingsClampL1TtlAndResolveDefault() {
    CacheSettings settings = CacheSettings.defaults();

    assertThat(settings.l1TtlFor(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(60));
    assertThat(settings.l1TtlFor(Duration.ofHours(2))).isEqualTo(Duration.ofSeconds(300));
    assertThat(settings.resolveTtl(null)).isEqualTo(Duration.ofSeconds(3600));
    assertThat(settings.resolveTtl(Duration.ZERO)).isEqualTo(Duration.ofSeconds(3600));
  }

  @Test
  void statisticsHitRate() {
    CacheStatistics stats = new CacheStatistics(3, 1, 2, 1, 0, 4, 0, 0, 0.5, 2);

    assertThat(stats.hitRate()).isEqualTo(0.75);
    assertThat(new CacheStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0).hitRate()).isZero();
  }
}
