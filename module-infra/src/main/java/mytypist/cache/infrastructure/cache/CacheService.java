package mytypist.cache.infrastructure.cache;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.common.function.ThrowingSupplier;
import mytypist.cache.core.domain.model.CacheEntry;
import mytypist.cache.core.domain.model.CacheKey;
import mytypist.cache.core.domain.model.CacheLayer;
import mytypist.cache.core.domain.model.CacheSettings;
import mytypist.cache.core.domain.model.CacheStatistics;
import mytypist.cache.core.domain.model.EncodedValue;
import mytypist.cache.core.domain.model.RemoteEntry;
import mytypist.cache.core.memory.EvictionListener;
import mytypist.cache.core.memory.MemoryCache;
import mytypist.cache.core.port.out.CacheSerializer;
import mytypist.cache.core.port.out.RemoteStore;
import mytypist.cache.core.tag.TagRegistry;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationEvent;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import mytypist.cache.infrastructure.cache.invalidation.CacheInvalidationSubscriber;
import mytypist.cache.infrastructure.cache.metrics.CacheMetricsCollector;
import mytypist.cache.infrastructure.cache.tag.TagIndex;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;
import mytypist.cache.infrastructure.serialization.JacksonCacheSerializer;

/**
 * Two-tier cache (L1: in-process {@link MemoryCache}, L2: {@link RemoteStore}).
 *
 * <h4>Read path</h4>
 *
 * <pre>
 * L1_CHECK --hit--> DONE
 *    |miss
 * L2_CHECK --hit--> PROMOTE_TO_L1 --> DONE
 *    |miss
 * MISS_DONE
 * </pre>
 *
 * <h4>Failure policy</h4>
 *
 * <ul>
 *   <li>Only {@code SerializationException} from {@code set}/{@code mset} reaches the caller
 *   <li>L2 failures: reads degrade to a miss, writes are logged at WARN and skipped
 *   <li>Undecodable entries count as a miss and are purged from both tiers
 * </ul>
 *
 * <h4>Stale backfill</h4>
 *
 * <ul>
 *   <li>Invalidation order is L2, then L1, then pub/sub
 *   <li>PROMOTE_TO_L1 carries the L1 write stamp taken before L1_CHECK; a key written or deleted
 *       in L1 since then is not overwritten by the older L2 copy
 * </ul>
 *
 * <p>L1 and L2 writes are two independent steps with no cross-tier transaction. L1 holds encoded
 * bytes, never the caller's object. The local tag registry only tracks keys resident in L1.
 */
@Slf4j
public class CacheService {

  private static final String COMPONENT = "CacheService";

  private final CacheSettings settings;
  private final MemoryCache memoryCache;
  private final RemoteStore remoteStore;
  private final CacheSerializer serializer;
  private final TagIndex tagIndex;
  private final CacheMetricsCollector metrics;
  private final LogicExecutor executor;
  private final CacheInvalidationPublisher invalidationPublisher;
  private final CacheInvalidationSubscriber invalidationSubscriber;
  private final String instanceId;

  @Builder
  public CacheService(
      CacheSettings settings,
      RemoteStore remoteStore,
      CacheSerializer serializer,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock,
      CacheInvalidationPublisher invalidationPublisher,
      CacheInvalidationSubscriber invalidationSubscriber,
      String instanceId) {
    this.settings = settings != null ? settings : CacheSettings.defaults();
    this.remoteStore = remoteStore;
    this.executor = executor;
    this.serializer =
        serializer != null
            ? serializer
            : new JacksonCacheSerializer(executor, this.settings.compressionThresholdBytes());
    this.metrics =
        new CacheMetricsCollector(
            meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
    this.tagIndex =
        new TagIndex(
            new TagRegistry(),
            remoteStore,
            executor,
            metrics,
            this.settings.keyPrefix(),
            this.settings.tagTtlGrace());
    this.memoryCache =
        new MemoryCache(
            this.settings.l1MaxEntries(),
            this.settings.l1Ttl(),
            clock != null ? clock : Clock.systemUTC(),
            new L1RemovalListener());
    this.metrics.bindL1Size(memoryCache::size);
    this.invalidationPublisher =
        invalidationPublisher != null ? invalidationPublisher : CacheInvalidationPublisher.NO_OP;
    this.invalidationSubscriber =
        invalidationSubscriber != null
            ? invalidationSubscriber
            : CacheInvalidationSubscriber.NO_OP;
    this.instanceId = instanceId != null ? instanceId : "local";
  }

  // ==================== Lifecycle ====================

  public void init() {
    if (!remoteStore.isEnabled()) {
      log.warn("[CacheService] Backing store disabled, running L1-only");
    } else if (remoteStore.ping()) {
      log.info("[CacheService] Backing store reachable");
    } else {
      log.warn(
          "[CacheService] Backing store unreachable at startup, serving from L1 until it recovers");
    }
    invalidationSubscriber.subscribe(this::applyRemoteInvalidation);
    log.info(
        "[CacheService] Ready: prefix={}, l1MaxEntries={}, l1Ttl={}, defaultTtl={}, instanceId={}",
        settings.keyPrefix(),
        settings.l1MaxEntries(),
        settings.l1Ttl(),
        settings.defaultTtl(),
        instanceId);
  }

  public void shutdown() {
    invalidationSubscriber.unsubscribe();
    clearLocal();
    log.info("[CacheService] Shut down, L1 cleared");
  }

  // ==================== Read ====================

  public Optional<Object> get(String key) {
    return get(key, "");
  }

  /**
   * Reads through L1 then L2, promoting an L2 hit into L1.
   *
   * <p>A cached {@code null} is reported as empty.
   */
  public Optional<Object> get(String key, String namespace) {
    long start = System.nanoTime();
    String physicalKey = physicalKey(key, namespace);
    long stamp = memoryCache.writeStamp();

    Optional<Decoded> l1 = readL1(physicalKey);
    if (l1.isPresent()) {
      metrics.recordHit(CacheLayer.L1, System.nanoTime() - start);
      return l1.map(Decoded::value);
    }

    Optional<Decoded> l2 = readL2(physicalKey, stamp);
    if (l2.isPresent()) {
      metrics.recordHit(CacheLayer.L2, System.nanoTime() - start);
      return l2.map(Decoded::value);
    }

    metrics.recordMiss(System.nanoTime() - start);
    log.trace("[CacheService] Miss: key={}", physicalKey);
    return Optional.empty();
  }

  /** Typed read; a value of another type is reported as empty. */
  public <T> Optional<T> get(String key, String namespace, Class<T> type) {
    Optional<Object> value = get(key, namespace);
    if (value.isPresent() && !type.isInstance(value.get())) {
      log.debug(
          "[CacheService] Type mismatch: key={}, expected={}, actual={}",
          key,
          type.getName(),
          value.get().getClass().getName());
      return Optional.empty();
    }
    return value.map(type::cast);
  }

  public Map<String, Object> mget(Collection<String> keys) {
    return mget(keys, "");
  }

  /**
   * Batch read: L1 first, then one pipelined L2 round trip for the L1 misses.
   *
   * <p>A cached {@code null} counts as a hit but is left out of the result, as {@link #get} reports
   * it empty.
   *
   * @return the caller's keys that hit a non-null value, mapped to their values
   */
  public Map<String, Object> mget(Collection<String> keys, String namespace) {
    if (keys == null || keys.isEmpty()) {
      return Map.of();
    }
    long start = System.nanoTime();
    long stamp = memoryCache.writeStamp();
    Set<String> requested = new LinkedHashSet<>(keys);
    Map<String, Object> result = new LinkedHashMap<>();
    Map<String, String> pending = new LinkedHashMap<>();
    List<CacheLayer> hitLayers = new ArrayList<>();

    for (String key : requested) {
      String physicalKey = physicalKey(key, namespace);
      Optional<Decoded> l1 = readL1(physicalKey);
      if (l1.isPresent()) {
        putIfNotNull(result, key, l1.get());
        hitLayers.add(CacheLayer.L1);
      } else {
        pending.put(physicalKey, key);
      }
    }

    if (!pending.isEmpty()) {
      Map<String, RemoteEntry> found = readL2Batch(pending.keySet());
      for (Map.Entry<String, String> miss : pending.entrySet()) {
        RemoteEntry entry = found.get(miss.getKey());
        Optional<Decoded> decoded =
            entry == null ? Optional.empty() : promote(miss.getKey(), entry, stamp);
        if (decoded.isPresent()) {
          putIfNotNull(result, miss.getValue(), decoded.get());
          hitLayers.add(CacheLayer.L2);
        }
      }
    }

    long perKey = (System.nanoTime() - start) / Math.max(1, requested.size());
    for (CacheLayer layer : hitLayers) {
      metrics.recordHit(layer, perKey);
    }
    for (int i = hitLayers.size(); i < requested.size(); i++) {
      metrics.recordMiss(perKey);
    }
    return result;
  }

  private static void putIfNotNull(Map<String, Object> result, String key, Decoded decoded) {
    if (decoded.value() != null) {
      result.put(key, decoded.value());
    }
  }

  // ==================== Write ====================

  public boolean set(String key, Object value, Duration ttl) {
    return set(key, value, ttl, List.of(), "", List.of());
  }

  public boolean set(String key, Object value, Duration ttl, Collection<String> tags) {
    return set(key, value, ttl, tags, "", List.of());
  }

  public boolean set(
      String key, Object value, Duration ttl, Collection<String> tags, String namespace) {
    return set(key, value, ttl, tags, namespace, List.of());
  }

  /**
   * Write-through: L1 unconditionally, then L2, then tag and dependency registration.
   *
   * @param ttl entry lifetime; null or non-positive means the configured default
   * @param dependsOn keys (same namespace) whose invalidation must also invalidate this one
   * @return true once L1 holds the value, even when L2 or the tag index degraded
   * @throws mytypist.cache.error.exception.SerializationException when the value cannot be encoded
   */
  public boolean set(
      String key,
      Object value,
      Duration ttl,
      Collection<String> tags,
      String namespace,
      Collection<String> dependsOn) {
    Duration effectiveTtl = settings.resolveTtl(ttl);
    String physicalKey = physicalKey(key, namespace);
    EncodedValue encoded = serializer.encode(physicalKey, value);

    memoryCache.put(physicalKey, encoded, settings.l1TtlFor(effectiveTtl));

    writeL2(
        "Set", physicalKey, () -> remoteStore.set(physicalKey, encoded.toBytes(), effectiveTtl));

    tagIndex.track(physicalKey, tags, effectiveTtl);
    if (dependsOn != null && !dependsOn.isEmpty()) {
      List<String> parents = new ArrayList<>(dependsOn.size());
      for (String parent : dependsOn) {
        parents.add(physicalKey(parent, namespace));
      }
      tagIndex.dependOn(physicalKey, parents, effectiveTtl);
    }

    invalidationPublisher.publish(CacheInvalidationEvent.evict(List.of(physicalKey), instanceId));
    log.debug(
        "[CacheService] Set: key={}, format={}, ttl={}",
        physicalKey,
        encoded.format(),
        effectiveTtl);
    return true;
  }

  public boolean mset(Map<String, ?> entries, Duration ttl) {
    return mset(entries, ttl, "");
  }

  /**
   * Batch write. Every value is encoded before anything is written, so a {@code
   * SerializationException} leaves both tiers untouched.
   */
  public boolean mset(Map<String, ?> entries, Duration ttl, String namespace) {
    if (entries == null || entries.isEmpty()) {
      return true;
    }
    Duration effectiveTtl = settings.resolveTtl(ttl);
    Map<String, EncodedValue> encoded = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : entries.entrySet()) {
      String physicalKey = physicalKey(entry.getKey(), namespace);
      encoded.put(physicalKey, serializer.encode(physicalKey, entry.getValue()));
    }

    Duration l1Ttl = settings.l1TtlFor(effectiveTtl);
    Map<String, byte[]> wire = new LinkedHashMap<>();
    encoded.forEach(
        (physicalKey, value) -> {
          memoryCache.put(physicalKey, value, l1Ttl);
          wire.put(physicalKey, value.toBytes());
        });

    writeL2("SetAll", String.valueOf(wire.size()), () -> remoteStore.setAll(wire, effectiveTtl));

    invalidationPublisher.publish(
        CacheInvalidationEvent.evict(new ArrayList<>(encoded.keySet()), instanceId));
    return true;
  }

  // ==================== Invalidation ====================

  public boolean delete(String key) {
    return delete(key, "");
  }

  /**
   * Removes the key and, transitively, every key that depends on it.
   *
   * <p>Idempotent: deleting an absent key is a successful no-op.
   *
   * @return always true
   */
  public boolean delete(String key, String namespace) {
    String physicalKey = physicalKey(key, namespace);
    Set<String> removed = removeWithDependents(Set.of(physicalKey));
    log.debug("[CacheService] Delete: key={}, removed={}", physicalKey, removed.size());
    return true;
  }

  /**
   * Invalidates every key registered under {@code tag}, plus their dependents.
   *
   * @return number of distinct keys removed from either tier
   */
  public int invalidateByTag(String tag) {
    Set<String> tagged = tagIndex.drain(tag);
    if (tagged.isEmpty()) {
      return 0;
    }
    Set<String> removed = removeWithDependents(tagged);
    log.info("[CacheService] Invalidated tag={}: {} keys removed", tag, removed.size());
    return removed.size();
  }

  /** Drops the given physical keys from this process's L1 only. */
  public void evictLocal(Collection<String> physicalKeys) {
    for (String physicalKey : physicalKeys) {
      dropL1(physicalKey);
    }
  }

  public void clearLocal() {
    memoryCache.clear();
    tagIndex.clearLocal();
  }

  /** Clears L1 here and asks every other instance to clear theirs. L2 is untouched. */
  public void clearAllL1() {
    clearLocal();
    invalidationPublisher.publish(CacheInvalidationEvent.clearAll(instanceId));
    log.info("[CacheService] L1 cleared on all instances");
  }

  // ==================== Loader ====================

  public <T> T getOrLoad(String key, Duration ttl, Supplier<T> loader) {
    return getOrLoad(key, ttl, loader, List.of());
  }

  /**
   * Read-through helper: returns the cached value or calls {@code loader} and caches its result.
   * A {@code null} result is returned but not cached. Loader exceptions propagate untouched.
   */
  @SuppressWarnings("unchecked")
  public <T> T getOrLoad(String key, Duration ttl, Supplier<T> loader, Collection<String> tags) {
    Optional<Object> cached = get(key);
    if (cached.isPresent()) {
      return (T) cached.get();
    }
    T loaded = loader.get();
    if (loaded != null) {
      set(key, loaded, ttl, tags);
    }
    return loaded;
  }

  // ==================== Stats ====================

  public CacheStatistics statistics() {
    return metrics.snapshot(memoryCache.size());
  }

  public CacheSettings settings() {
    return settings;
  }

  /** Physical key for a logical key, as stored in both tiers. */
  public String physicalKey(String key, String namespace) {
    return CacheKey.of(settings.keyPrefix(), namespace, key).value();
  }

  int localTagCount() {
    return tagIndex.localTagCount();
  }

  // ==================== internals ====================

  private Optional<Decoded> readL1(String physicalKey) {
    Optional<CacheEntry> entry = memoryCache.get(physicalKey);
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    EncodedValue value = entry.get().value();
    return decodeOrPurge(physicalKey, CacheLayer.L1, () -> serializer.decode(value));
  }

  private Optional<Decoded> readL2(String physicalKey, long stamp) {
    Optional<RemoteEntry> entry =
        executor.executeOrCatch(
            () -> remoteStore.get(physicalKey),
            e -> {
              onL2Failure("Get", physicalKey, e);
              return Optional.empty();
            },
            TaskContext.of(COMPONENT, "GetL2", physicalKey));
    return entry.flatMap(found -> promote(physicalKey, found, stamp));
  }

  private Map<String, RemoteEntry> readL2Batch(Collection<String> physicalKeys) {
    return executor.executeOrCatch(
        () -> remoteStore.getAll(physicalKeys),
        e -> {
          onL2Failure("GetAll", String.valueOf(physicalKeys.size()), e);
          return Map.of();
        },
        TaskContext.of(COMPONENT, "GetAllL2", String.valueOf(physicalKeys.size())));
  }

  // L1 copy expires no later than the L2 key it came from; a newer L1 write since stamp wins
  private Optional<Decoded> promote(String physicalKey, RemoteEntry entry, long stamp) {
    return decodeOrPurge(
        physicalKey,
        CacheLayer.L2,
        () -> {
          EncodedValue value = EncodedValue.fromBytes(entry.payload());
          Object result = serializer.decode(value);
          boolean promoted =
              memoryCache.putIfUnchangedSince(
                  physicalKey, value, entry.ttlCappedAt(settings.l1Ttl()), stamp);
          log.trace("[CacheService] L2 hit: key={}, promoted={}", physicalKey, promoted);
          return result;
        });
  }

  private Optional<Decoded> decodeOrPurge(
      String physicalKey, CacheLayer layer, ThrowingSupplier<Object> decoding) {
    return executor.executeOrCatch(
        () -> Optional.of(new Decoded(decoding.get())),
        e -> {
          onDecodeFailure(physicalKey, layer, e);
          return Optional.empty();
        },
        TaskContext.of(COMPONENT, "Decode", physicalKey));
  }

  private void onDecodeFailure(String physicalKey, CacheLayer layer, Throwable cause) {
    metrics.recordDecodeFailure();
    log.warn(
        "[CacheService] Undecodable {} entry treated as miss and purged: key={}, cause={}",
        layer,
        physicalKey,
        cause.getMessage());
    dropL1(physicalKey);
    if (layer == CacheLayer.L2) {
      writeL2("PurgeCorrupt", physicalKey, () -> remoteStore.delete(List.of(physicalKey)));
    }
  }

  // never propagates; false when the write degraded
  private boolean writeL2(String operation, String detail, Runnable write) {
    return executor.executeOrCatch(
        () -> {
          write.run();
          return true;
        },
        e -> {
          onL2Failure(operation, detail, e);
          return false;
        },
        TaskContext.of(COMPONENT, operation, detail));
  }

  private void onL2Failure(String operation, String detail, Throwable cause) {
    metrics.recordL2Failure();
    log.warn("[CacheService] L2 {} degraded: {} ({})", operation, detail, cause.getMessage());
  }

  /**
   * Collects the dependency closure of {@code roots}, then deletes every key in it from both tiers.
   *
   * <h4>Order: registrations, L2, L1, pub/sub</h4>
   *
   * <p>Registrations are drained before any value is deleted. L2 goes before L1 so a concurrent
   * read cannot refill L1 from an L2 copy that is about to disappear.
   */
  private Set<String> removeWithDependents(Set<String> roots) {
    Set<String> closure = new LinkedHashSet<>(roots);
    Deque<String> queue = new ArrayDeque<>(roots);
    while (!queue.isEmpty()) {
      String parent = queue.poll();
      for (String child : tagIndex.drainDependents(parent)) {
        if (closure.add(child)) {
          queue.add(child);
        }
      }
    }

    Set<String> l2Removed =
        executor.executeOrCatch(
            () -> remoteStore.delete(closure),
            e -> {
              onL2Failure("Delete", String.valueOf(closure.size()), e);
              return Set.of();
            },
            TaskContext.of(COMPONENT, "DeleteL2", String.valueOf(closure.size())));
    Set<String> removed = new LinkedHashSet<>(l2Removed);

    for (String physicalKey : closure) {
      if (dropL1(physicalKey)) {
        removed.add(physicalKey);
      }
    }

    invalidationPublisher.publish(
        CacheInvalidationEvent.evict(new ArrayList<>(closure), instanceId));
    return removed;
  }

  private void applyRemoteInvalidation(CacheInvalidationEvent event) {
    switch (event.type()) {
      case EVICT -> {
        evictLocal(event.keys());
        log.debug(
            "[CacheService] L1 evicted by {}: {} keys",
            event.sourceInstanceId(),
            event.keys().size());
      }
      case CLEAR_ALL -> {
        clearLocal();
        log.debug("[CacheService] L1 cleared by {}", event.sourceInstanceId());
      }
    }
  }

  private boolean dropL1(String physicalKey) {
    boolean present = memoryCache.delete(physicalKey);
    tagIndex.untrack(physicalKey);
    return present;
  }

  /** Keeps the local tag registry to keys L1 still holds. */
  private final class L1RemovalListener implements EvictionListener {

    @Override
    public void onEviction(String key) {
      metrics.recordEviction();
      tagIndex.untrack(key);
    }

    @Override
    public void onExpiry(String key) {
      tagIndex.untrack(key);
    }
  }

  /** Wraps a decoded value so a cached {@code null} is distinguishable from a miss. */
  private record Decoded(Object value) {}
}
