package mytypist.cache.infrastructure.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.core.domain.model.EncodedValue;
import mytypist.cache.core.domain.model.PayloadFormat;
import mytypist.cache.core.port.out.CacheSerializer;
import mytypist.cache.error.exception.DecodeException;
import mytypist.cache.error.exception.SerializationException;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import mytypist.cache.infrastructure.executor.strategy.ExceptionTranslator;
import mytypist.cache.util.GzipUtils;

/**
 * Two-path value codec.
 *
 * <h4>Encoding</h4>
 *
 * <ol>
 *   <li>JSON-native trees (null, String, Boolean, Integer, finite Double, List, Map with String
 *       keys, nested) are written by Jackson with map entries sorted by key
 *   <li>any other {@link Serializable} value, or a tree Jackson refuses to write, goes through JDK
 *       serialization
 *   <li>a body larger than {@code compressionThresholdBytes} is gzipped
 * </ol>
 *
 * <p>The JSON path is restricted to shapes Jackson reads back as equal objects (a Long or a Float
 * would come back as Integer or Double), so {@code decode(encode(v)).equals(v)} holds for every
 * accepted value.
 *
 * <h4>JDK payloads</h4>
 *
 * <p>L2 bytes come from a shared store, so every JDK read runs under an {@link ObjectInputFilter}
 * (pattern syntax of {@link ObjectInputFilter.Config#createFilter}). The default admits {@code
 * java.base} and {@code mytypist.**} classes within depth and size limits; applications caching
 * their own types extend the allowlist. A rejected stream decodes as a {@code DecodeException}.
 */
@Slf4j
public class JacksonCacheSerializer implements CacheSerializer {

  private static final String COMPONENT = "Serializer";

  public static final String DEFAULT_DESERIALIZATION_FILTER =
      "maxdepth=256;maxrefs=1000000;maxbytes=67108864;maxarray=16777216;"
          + "java.base/*;mytypist.**;!*";

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final int compressionThresholdBytes;
  private final ObjectInputFilter deserializationFilter;

  public JacksonCacheSerializer(LogicExecutor executor, int compressionThresholdBytes) {
    this(executor, compressionThresholdBytes, DEFAULT_DESERIALIZATION_FILTER);
  }

  public JacksonCacheSerializer(
      LogicExecutor executor, int compressionThresholdBytes, String deserializationFilter) {
    this(defaultObjectMapper(), executor, compressionThresholdBytes, deserializationFilter);
  }

  /**
   * @param deserializationFilter {@link ObjectInputFilter} pattern applied to JDK payloads
   * @throws IllegalArgumentException when the pattern does not parse
   */
  public JacksonCacheSerializer(
      ObjectMapper objectMapper,
      LogicExecutor executor,
      int compressionThresholdBytes,
      String deserializationFilter) {
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.compressionThresholdBytes = compressionThresholdBytes;
    this.deserializationFilter = ObjectInputFilter.Config.createFilter(deserializationFilter);
  }

  /** Sorted map keys: equal trees always give identical bytes. */
  public static ObjectMapper defaultObjectMapper() {
    return JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();
  }

  @Override
  public EncodedValue encode(String key, Object value) {
    return executor.executeWithTranslation(
        () -> encodeInternal(key, value),
        ExceptionTranslator.forSerialization(value),
        TaskContext.of(COMPONENT, "Encode", key));
  }

  @Override
  public Object decode(EncodedValue value) {
    return executor.executeWithTranslation(
        () -> readBody(value.format(), inflate(value)),
        ExceptionTranslator.forDecode(),
        TaskContext.of(COMPONENT, "Decode", value.format().name()));
  }

  private EncodedValue encodeInternal(String key, Object value) throws IOException {
    if (isJsonNative(value, Collections.newSetFromMap(new IdentityHashMap<>()))) {
      byte[] json = tryWriteJson(key, value);
      if (json != null) {
        return compressIfLarge(PayloadFormat.JSON, json);
      }
    }
    if (value instanceof Serializable) {
      return compressIfLarge(PayloadFormat.JDK, writeJdk(value));
    }
    throw new SerializationException(key, value);
  }

  // null when Jackson rejects the tree (e.g. a string with an unpaired surrogate)
  private byte[] tryWriteJson(String key, Object value) {
    return executor.executeOrDefault(
        () -> objectMapper.writeValueAsBytes(value),
        null,
        TaskContext.of(COMPONENT, "WriteJson", key));
  }

  private static byte[] writeJdk(Object value) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ObjectOutputStream oos = new ObjectOutputStream(out)) {
      oos.writeObject(value);
    }
    return out.toByteArray();
  }

  private EncodedValue compressIfLarge(PayloadFormat format, byte[] body) throws IOException {
    if (body.length <= compressionThresholdBytes) {
      return EncodedValue.of(format, body);
    }
    byte[] compressed = GzipUtils.compress(body);
    log.trace(
        "[Serializer] Compressed {} -> {} bytes ({})", body.length, compressed.length, format);
    return EncodedValue.of(format.compressed(), compressed);
  }

  private static byte[] inflate(EncodedValue value) throws IOException {
    byte[] body = value.body();
    if (!value.format().isCompressed()) {
      return body;
    }
    if (!GzipUtils.isGzipped(body)) {
      throw new DecodeException("format " + value.format() + " but body has no gzip header");
    }
    return GzipUtils.decompress(body);
  }

  private Object readBody(PayloadFormat format, byte[] body) throws Exception {
    return switch (format) {
      case JSON, GZIP_JSON -> objectMapper.readValue(body, Object.class);
      case JDK, GZIP_JDK -> {
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(body))) {
          ois.setObjectInputFilter(deserializationFilter);
          yield ois.readObject();
        }
      }
    };
  }

  // cycles are not JSON-native; the visited set stops the walk
  private static boolean isJsonNative(Object value, Set<Object> visiting) {
    if (value == null
        || value instanceof String
        || value instanceof Boolean
        || value instanceof Integer) {
      return true;
    }
    if (value instanceof Double d) {
      return Double.isFinite(d);
    }
    if (value instanceof List<?> list) {
      if (!visiting.add(list)) {
        return false;
      }
      for (Object element : list) {
        if (!isJsonNative(element, visiting)) {
          return false;
        }
      }
      visiting.remove(list);
      return true;
    }
    if (value instanceof Map<?, ?> map) {
      if (!visiting.add(map)) {
        return false;
      }
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String) || !isJsonNative(entry.getValue(), visiting)) {
          return false;
        }
      }
      visiting.remove(map);
      return true;
    }
    return false;
  }
}
