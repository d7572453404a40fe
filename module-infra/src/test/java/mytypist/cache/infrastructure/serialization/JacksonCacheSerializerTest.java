package mytypist.cache.infrastructure.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.Serializable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import mytypist.cache.core.domain.model.EncodedValue;
import mytypist.cache.core.domain.model.PayloadFormat;
import mytypist.cache.error.exception.DecodeException;
import mytypist.cache.error.exception.SerializationException;
import mytypist.cache.infrastructure.executor.DefaultLogicExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("JacksonCacheSerializer")
class JacksonCacheSerializerTest {

  private static final int THRESHOLD = 64;

  private JacksonCacheSerializer serializer;

  record Profile(String name, long id) implements Serializable {}

  record Node(int depth, Node next) implements Serializable {}

  @BeforeEach
  void setUp() {
    serializer = new JacksonCacheSerializer(new DefaultLogicExecutor(), THRESHOLD);
  }

  @Nested
  @DisplayName("format selection")
  class FormatSelection {

    @Test
    @DisplayName("JSON-native trees use the JSON path")
    void jsonForNativeTree() {
      EncodedValue encoded = serializer.encode("k", Map.of("name", "Alice", "age", 30));

      assertThat(encoded.format()).isEqualTo(PayloadFormat.JSON);
      assertThat(new String(encoded.body(), StandardCharsets.UTF_8))
          .isEqualTo("{\"age\":30,\"name\":\"Alice\"}");
    }

    @Test
    @DisplayName("Long and BigDecimal fall back to JDK serialization to keep their type")
    void jdkForNonNativeNumbers() {
      assertThat(serializer.encode("k", 5L).format()).isEqualTo(PayloadFormat.JDK);
      assertThat(serializer.decode(serializer.encode("k", new BigDecimal("1.50"))))
          .isEqualTo(new BigDecimal("1.50"));
    }

    @Test
    @DisplayName("Serializable records round-trip through JDK serialization")
    void serializableRecord() {
      Profile profile = new Profile("Alice", 7L);

      EncodedValue encoded = serializer.encode("k", profile);

      assertThat(encoded.format()).isEqualTo(PayloadFormat.JDK);
      assertThat(serializer.decode(encoded)).isEqualTo(profile);
    }

    @Test
    @DisplayName("a map holding a non-native value is encoded as a whole by JDK")
    void mixedMap() {
      Map<String, Object> mixed = new HashMap<>();
      mixed.put("profile", new Profile("Bob", 1L));

      EncodedValue encoded = serializer.encode("k", mixed);

      assertThat(encoded.format()).isEqualTo(PayloadFormat.JDK);
      assertThat(serializer.decode(encoded)).isEqualTo(mixed);
    }

    @Test
    @DisplayName("null is cached as JSON null")
    void nullValue() {
      EncodedValue encoded = serializer.encode("k", null);

      assertThat(encoded.format()).isEqualTo(PayloadFormat.JSON);
      assertThat(serializer.decode(encoded)).isNull();
    }
  }

  @Nested
  @DisplayName("compression")
  class Compression {

    @Test
    @DisplayName("a body at the threshold stays uncompressed")
    void atThreshold() {
      String value = "x".repeat(THRESHOLD - 2); // quotes make it exactly THRESHOLD

      assertThat(serializer.encode("k", value).format()).isEqualTo(PayloadFormat.JSON);
    }

    @Test
    @DisplayName("a body over the threshold is gzipped and decodes back")
    void overThreshold() {
      String value = "y".repeat(5_000);

      EncodedValue encoded = serializer.encode("k", value);

      assertThat(encoded.format()).isEqualTo(PayloadFormat.GZIP_JSON);
      assertThat(encoded.size()).isLessThan(5_000);
      assertThat(serializer.decode(encoded)).isEqualTo(value);
    }

    @Test
    @DisplayName("large JDK payloads use GZIP_JDK")
    void largeJdk() {
      ArrayList<Profile> profiles = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        profiles.add(new Profile("user-" + i, i));
      }

      EncodedValue encoded = serializer.encode("k", profiles);

      assertThat(encoded.format()).isEqualTo(PayloadFormat.GZIP_JDK);
      assertThat(serializer.decode(encoded)).isEqualTo(profiles);
    }
  }

  @Nested
  @DisplayName("determinism")
  class Determinism {

    @Test
    @DisplayName("equal maps with different insertion order encode to identical bytes")
    void insertionOrderIrrelevant() {
      Map<String, Object> first = new LinkedHashMap<>();
      first.put("b", 2);
      first.put("a", List.of(1, 2));
      Map<String, Object> second = new LinkedHashMap<>();
      second.put("a", List.of(1, 2));
      second.put("b", 2);

      assertThat(serializer.encode("k", first)).isEqualTo(serializer.encode("k", second));
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    @DisplayName("a non-serializable value raises SerializationException naming the key")
    void notSerializable() {
      assertThatThrownBy(() -> serializer.encode("user:1", new Object()))
          .isInstanceOf(SerializationException.class)
          .hasMessageContaining("user:1");
    }

    @Test
    @DisplayName("a cyclic list skips the JSON path and round-trips through JDK")
    void cyclicList() {
      List<Object> cyclic = new ArrayList<>();
      cyclic.add(cyclic);

      assertThat(serializer.decode(serializer.encode("k", cyclic))).isInstanceOf(List.class);
    }

    @Test
    @DisplayName("corrupt gzip bodies raise DecodeException")
    void corruptGzip() {
      EncodedValue corrupt = EncodedValue.of(PayloadFormat.GZIP_JSON, new byte[] {1, 2, 3});

      assertThatThrownBy(() -> serializer.decode(corrupt)).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("malformed JSON raises DecodeException")
    void malformedJson() {
      EncodedValue corrupt =
          EncodedValue.of(PayloadFormat.JSON, "{\"a\":".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> serializer.decode(corrupt)).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("an unknown format tag raises DecodeException")
    void unknownTag() {
      assertThatThrownBy(() -> serializer.decode(new byte[] {0x7f, 1}))
          .isInstanceOf(DecodeException.class);
    }
  }

  @Nested
  @DisplayName("deserialization filter")
  class DeserializationFilter {

    @Test
    @DisplayName("the default filter admits application and java.base classes")
    void defaultAdmitsOwnTypes() {
      ArrayList<Profile> profiles = new ArrayList<>(List.of(new Profile("a", 1L)));

      assertThat(serializer.decode(serializer.encode("k", profiles))).isEqualTo(profiles);
    }

    @Test
    @DisplayName("a class outside the allowlist raises DecodeException")
    void rejectsClassOutsideAllowlist() {
      JacksonCacheSerializer strict =
          new JacksonCacheSerializer(new DefaultLogicExecutor(), THRESHOLD, "java.base/*;!*");
      EncodedValue encoded = strict.encode("k", new Profile("a", 1L));

      assertThatThrownBy(() -> strict.decode(encoded)).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("a graph deeper than maxdepth raises DecodeException instead of overflowing")
    void rejectsDeepGraph() {
      JacksonCacheSerializer shallow =
          new JacksonCacheSerializer(
              new DefaultLogicExecutor(), THRESHOLD, "maxdepth=8;java.base/*;mytypist.**;!*");
      Node chain = null;
      for (int i = 0; i < 50; i++) {
        chain = new Node(i, chain);
      }
      EncodedValue encoded = shallow.encode("k", chain);

      assertThatThrownBy(() -> shallow.decode(encoded)).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("an unparseable filter pattern is rejected at construction")
    void badPattern() {
      assertThatThrownBy(
              () -> new JacksonCacheSerializer(new DefaultLogicExecutor(), THRESHOLD, "maxdepth=x"))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
