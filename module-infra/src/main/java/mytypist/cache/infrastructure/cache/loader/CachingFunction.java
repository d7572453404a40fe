package mytypist.cache.infrastructure.cache.loader;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import mytypist.cache.infrastructure.cache.CacheService;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;

/**
 * Wraps a function so its results are served from {@link CacheService}.
 *
 * <pre>{@code
 * Function<TemplateQuery, List<Template>> cached =
 *     CachingFunction.builder(cacheService, executor)
 *         .keyPrefix("api")
 *         .name("listTemplates")
 *         .ttl(Duration.ofMinutes(5))
 *         .tags(List.of("templates"))
 *         .build(templateRepository::search);
 * }</pre>
 *
 * <p>Default key: {@code <keyPrefix>:<name>:<md5 of the argument as sorted-key JSON>}, so equal
 * arguments share an entry regardless of map or property order.
 */
public final class CachingFunction {

  private static final ObjectMapper KEY_MAPPER =
      JsonMapper.builder()
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .build();

  private CachingFunction() {}

  public static Builder builder(CacheService cacheService, LogicExecutor executor) {
    return new Builder(cacheService, executor);
  }

  /** md5 hex of the argument's sorted-key JSON; falls back to {@code String.valueOf}. */
  static String digest(Object argument, LogicExecutor executor) {
    String rendered =
        executor.executeOrDefault(
            () -> KEY_MAPPER.writeValueAsString(argument),
            String.valueOf(argument),
            TaskContext.of("CachingFunction", "RenderKey"));
    return executor.execute(
        () -> {
          MessageDigest md = MessageDigest.getInstance("MD5");
          return HexFormat.of().formatHex(md.digest(rendered.getBytes(StandardCharsets.UTF_8)));
        },
        TaskContext.of("CachingFunction", "Digest"));
  }

  public static final class Builder {

    private final CacheService cacheService;
    private final LogicExecutor executor;
    private String keyPrefix = "func";
    private String name;
    private Duration ttl;
    private Collection<String> tags = List.of();
    private Function<Object, String> keyFunction;

    private Builder(CacheService cacheService, LogicExecutor executor) {
      this.cacheService = Objects.requireNonNull(cacheService, "cacheService");
      this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    public Builder tags(Collection<String> tags) {
      this.tags = tags == null ? List.of() : List.copyOf(tags);
      return this;
    }

    /** Replaces the md5 digest; the result still gets the prefix and name in front. */
    public Builder keyFunction(Function<Object, String> keyFunction) {
      this.keyFunction = keyFunction;
      return this;
    }

    public <A, R> Function<A, R> build(Function<A, R> delegate) {
      Objects.requireNonNull(delegate, "delegate");
      String base = keyPrefix + ":" + requireName() + ":";
      Function<Object, String> keys =
          keyFunction != null ? keyFunction : argument -> digest(argument, executor);
      Duration entryTtl = ttl;
      Collection<String> entryTags = tags;
      return argument -> {
        String key = base + keys.apply(argument);
        return cacheService.getOrLoad(key, entryTtl, () -> delegate.apply(argument), entryTags);
      };
    }

    public <R> Supplier<R> build(Supplier<R> delegate) {
      Objects.requireNonNull(delegate, "delegate");
      Function<Object, R> wrapped = build(ignored -> delegate.get());
      return () -> wrapped.apply(null);
    }

    private String requireName() {
      if (name == null || name.isBlank()) {
        throw new IllegalStateException("CachingFunction requires a name");
      }
      return name;
    }
  }
}
