package mytypist.cache.core.tag;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TagRegistryTest {

  private TagRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new TagRegistry();
  }

  @Test
  @DisplayName("register keeps both directions in step")
  void registerBothDirections() {
    registry.register("k1", List.of("user:1", "docs"));
    registry.register("k2", List.of("docs"));

    assertThat(registry.keysFor("docs")).containsExactlyInAnyOrder("k1", "k2");
    assertThat(registry.tagsFor("k1")).containsExactlyInAnyOrder("user:1", "docs");
  }

  @Test
  @DisplayName("removeTag returns its keys and drops the reverse edges")
  void removeTagDropsReverseEdges() {
    registry.register("k1", List.of("docs", "user:1"));
    registry.register("k2", List.of("docs"));

    assertThat(registry.removeTag("docs")).containsExactlyInAnyOrder("k1", "k2");
    assertThat(registry.keysFor("docs")).isEmpty();
    assertThat(registry.tagsFor("k1")).containsExactly("user:1");
    assertThat(registry.tagsFor("k2")).isEmpty();
  }

  @Test
  void removeUnknownTagIsEmpty() {
    assertThat(registry.removeTag("missing")).isEmpty();
  }

  @Test
  @DisplayName("removeKey unlinks the key from every tag and drops emptied tags")
  void removeKeyUnlinks() {
    registry.register("k1", List.of("a", "b"));
    registry.register("k2", List.of("b"));

    registry.removeKey("k1");

    assertThat(registry.keysFor("a")).isEmpty();
    assertThat(registry.keysFor("b")).containsExactly("k2");
    assertThat(registry.tagCount()).isEqualTo(1);
  }

  @Test
  void clearDropsEverything() {
    registry.register("k1", List.of("a", "b"));

    registry.clear();

    assertThat(registry.tagCount()).isZero();
    assertThat(registry.tagsFor("k1")).isEmpty();
  }

  @Test
  void dependencyTagNaming() {
    assertThat(TagRegistry.dependencyTag("mytypist:tpl:1")).isEqualTo("dep:mytypist:tpl:1");
  }

  @Test
  void emptyTagListIsIgnored() {
    registry.register("k", List.of());

    assertThat(registry.tagsFor("k")).isEmpty();
    assertThat(registry.tagCount()).isZero();
  }
}
