package mytypist.cache.infrastructure.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.core.domain.model.RemoteEntry;
import mytypist.cache.core.port.out.RemoteStore;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import mytypist.cache.infrastructure.executor.strategy.ExceptionTranslator;
import mytypist.cache.infrastructure.redis.script.CacheLuaScripts;
import org.redisson.api.BatchOptions;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

/**
 * {@link RemoteStore} on Redis through Redisson.
 *
 * <h4>Codecs</h4>
 *
 * <ul>
 *   <li>values: {@link ByteArrayCodec}, the payload is already encoded by the serializer
 *   <li>tag sets and scripts: {@link StringCodec}
 * </ul>
 *
 * <p>Every call runs through {@link LogicExecutor#executeWithTranslation} with {@link
 * ExceptionTranslator#forBackingStore()}, so callers only ever see {@code
 * BackingStoreUnavailableException}.
 */
@Slf4j
public class RedissonRemoteStore implements RemoteStore {

  private static final String COMPONENT = "RedisStore";
  private static final long PTTL_NO_DEADLINE = -1L;
  private static final long PTTL_MISSING = -2L;

  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final int chunkSize;
  private final ExceptionTranslator translator = ExceptionTranslator.forBackingStore();

  public RedissonRemoteStore(RedissonClient redissonClient, LogicExecutor executor, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be >= 1");
    }
    this.redissonClient = redissonClient;
    this.executor = executor;
    this.chunkSize = chunkSize;
  }

  @Override
  public Optional<RemoteEntry> get(String key) {
    return Optional.ofNullable(getAll(List.of(key)).get(key));
  }

  /** GET and PTTL for each key in one pipelined batch per chunk. */
  @Override
  public Map<String, RemoteEntry> getAll(Collection<String> keys) {
    Map<String, RemoteEntry> found = new LinkedHashMap<>();
    for (List<String> chunk : chunks(keys)) {
      BatchResult<?> result =
          executor.executeWithTranslation(
              () -> {
                RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
                for (String key : chunk) {
                  RBucketAsync<byte[]> bucket = batch.getBucket(key, ByteArrayCodec.INSTANCE);
                  bucket.getAsync();
                  bucket.remainTimeToLiveAsync();
                }
                return batch.execute();
              },
              translator,
              TaskContext.of(COMPONENT, "Get", chunk.size() == 1 ? chunk.get(0) : "batch"));
      collectEntries(chunk, result.getResponses(), found);
    }
    return found;
  }

  private static void collectEntries(
      List<String> chunk, List<?> responses, Map<String, RemoteEntry> found) {
    for (int i = 0; i < chunk.size(); i++) {
      int base = i * 2;
      if (base + 1 >= responses.size()) {
        break;
      }
      if (!(responses.get(base) instanceof byte[] payload)) {
        continue;
      }
      long pttl = responses.get(base + 1) instanceof Long l ? l : PTTL_NO_DEADLINE;
      if (pttl == PTTL_MISSING || pttl == 0) {
        // expired between GET and PTTL
        continue;
      }
      Duration remaining = pttl == PTTL_NO_DEADLINE ? null : Duration.ofMillis(pttl);
      found.put(chunk.get(i), new RemoteEntry(payload, remaining));
    }
  }

  @Override
  public void set(String key, byte[] value, Duration ttl) {
    executor.executeWithTranslation(
        () -> {
          redissonClient
              .<byte[]>getBucket(key, ByteArrayCodec.INSTANCE)
              .set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
          return null;
        },
        translator,
        TaskContext.of(COMPONENT, "Set", key));
  }

  @Override
  public void setAll(Map<String, byte[]> entries, Duration ttl) {
    List<String> keys = new ArrayList<>(entries.keySet());
    for (List<String> chunk : chunks(keys)) {
      executor.executeWithTranslation(
          () -> {
            RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
            for (String key : chunk) {
              batch
                  .<byte[]>getBucket(key, ByteArrayCodec.INSTANCE)
                  .setAsync(entries.get(key), ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
            return batch.execute();
          },
          translator,
          TaskContext.of(COMPONENT, "SetAll", String.valueOf(chunk.size())));
    }
    log.debug("[RedissonRemoteStore] Pipelined {} entries, ttl={}", entries.size(), ttl);
  }

  @Override
  public Set<String> delete(Collection<String> keys) {
    Set<String> deleted = new LinkedHashSet<>();
    for (List<String> chunk : chunks(keys)) {
      BatchResult<?> result =
          executor.executeWithTranslation(
              () -> {
                RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
                for (String key : chunk) {
                  batch.getBucket(key, ByteArrayCodec.INSTANCE).deleteAsync();
                }
                return batch.execute();
              },
              translator,
              TaskContext.of(COMPONENT, "Delete", String.valueOf(chunk.size())));
      List<?> responses = result.getResponses();
      for (int i = 0; i < chunk.size() && i < responses.size(); i++) {
        if (Boolean.TRUE.equals(responses.get(i))) {
          deleted.add(chunk.get(i));
        }
      }
    }
    return deleted;
  }

  @Override
  public void addToSet(String setKey, String member) {
    executor.executeWithTranslation(
        () -> redissonClient.<String>getSet(setKey, StringCodec.INSTANCE).add(member),
        translator,
        TaskContext.of(COMPONENT, "AddToSet", setKey));
  }

  @Override
  public Set<String> setMembers(String setKey) {
    return executor.executeWithTranslation(
        () -> redissonClient.<String>getSet(setKey, StringCodec.INSTANCE).readAll(),
        translator,
        TaskContext.of(COMPONENT, "SetMembers", setKey));
  }

  @Override
  public void expire(String key, Duration ttl) {
    Long moved =
        executor.executeWithTranslation(
            () ->
                script()
                    .<Long>eval(
                        RScript.Mode.READ_WRITE,
                        CacheLuaScripts.EXTEND_TTL,
                        RScript.ReturnType.INTEGER,
                        List.of(key),
                        String.valueOf(ttl.toMillis())),
            translator,
            TaskContext.of(COMPONENT, "Expire", key));
    log.trace("[RedissonRemoteStore] Extend TTL key={}, ttl={}, moved={}", key, ttl, moved);
  }

  @Override
  public Set<String> drainSet(String setKey) {
    List<Object> members =
        executor.executeWithTranslation(
            () ->
                script()
                    .<List<Object>>eval(
                        RScript.Mode.READ_WRITE,
                        CacheLuaScripts.DRAIN_SET,
                        RScript.ReturnType.MULTI,
                        List.of(setKey)),
            translator,
            TaskContext.of(COMPONENT, "DrainSet", setKey));
    Set<String> drained = new HashSet<>();
    if (members != null) {
      for (Object member : members) {
        drained.add(String.valueOf(member));
      }
    }
    return drained;
  }

  @Override
  public boolean ping() {
    return executor.executeOrDefault(
        () -> {
          Object pong =
              script()
                  .eval(
                      RScript.Mode.READ_ONLY,
                      CacheLuaScripts.PING,
                      RScript.ReturnType.STATUS,
                      List.of());
          return "PONG".equalsIgnoreCase(String.valueOf(pong));
        },
        false,
        TaskContext.of(COMPONENT, "Ping"));
  }

  private RScript script() {
    return redissonClient.getScript(StringCodec.INSTANCE);
  }

  private List<List<String>> chunks(Collection<String> keys) {
    List<List<String>> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>(Math.min(chunkSize, keys.size()));
    for (String key : keys) {
      current.add(key);
      if (current.size() == chunkSize) {
        chunks.add(current);
        current = new ArrayList<>(chunkSize);
      }
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }
    return chunks;
  }
}
