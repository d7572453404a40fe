package mytypist.cache.infrastructure.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import mytypist.cache.core.domain.model.EncodedValue;
import mytypist.cache.infrastructure.executor.DefaultLogicExecutor;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.Tag;

@Tag("unit")
class JacksonCacheSerializerPropertyTest {

  private final JacksonCacheSerializer serializer =
      new JacksonCacheSerializer(new DefaultLogicExecutor(), 256);

  @Property(tries = 300)
  void decodeInvertsEncode(@ForAll("values") Object value) {
    EncodedValue encoded = serializer.encode("prop", value);

    assertThat(serializer.decode(encoded)).isEqualTo(value);
    assertThat(serializer.decode(encoded.toBytes())).isEqualTo(value);
  }

  @Property(tries = 200)
  void equalValuesEncodeIdentically(@ForAll("values") Object value) {
    assertThat(serializer.encode("a", value).toBytes())
        .isEqualTo(serializer.encode("b", value).toBytes());
  }

  @Provide
  Arbitrary<Object> values() {
    Arbitrary<Object> leaves =
        Arbitraries.oneOf(
            Arbitraries.strings()
                .withCharRange('\u0000', '\uD7FF')
                .withCharRange('\uE000', '\uFFFD')
                .ofMaxLength(600)
                .map(s -> (Object) s),
            Arbitraries.integers().map(i -> (Object) i),
            Arbitraries.longs().map(l -> (Object) l),
            Arbitraries.doubles().map(d -> (Object) d),
            Arbitraries.of(true, false).map(b -> (Object) b));
    Arbitrary<Object> lists = leaves.list().ofMaxSize(20).map(l -> (Object) List.copyOf(l));
    Arbitrary<Object> maps =
        Arbitraries.maps(Arbitraries.strings().alpha().ofMaxLength(8), leaves)
            .ofMaxSize(10)
            .map(m -> (Object) Map.copyOf(m));
    return Arbitraries.oneOf(leaves, lists, maps);
  }
}
