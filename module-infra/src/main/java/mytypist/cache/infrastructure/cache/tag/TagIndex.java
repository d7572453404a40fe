package mytypist.cache.infrastructure.cache.tag;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.core.port.out.RemoteStore;
import mytypist.cache.core.tag.TagRegistry;
import mytypist.cache.infrastructure.cache.metrics.CacheMetricsCollector;
import mytypist.cache.infrastructure.executor.LogicExecutor;
import mytypist.cache.infrastructure.executor.TaskContext;

/**
 * Tag and dependency index over both scopes.
 *
 * <ul>
 *   <li>local: {@link TagRegistry}, this process only
 *   <li>remote: one Redis set per tag at {@code <prefix>tag:<tag>}, shared by every process
 * </ul>
 *
 * <p>A tag set's TTL is pushed out to {@code member ttl + grace} on every registration and never
 * pulled in, so it outlives its longest-lived member.
 *
 * <p>{@link #drain(String)} enumerates and removes the registration before the caller deletes any
 * value; a key registered after the drain stays registered for the next pass.
 */
@Slf4j
public class TagIndex {

  private static final String COMPONENT = "TagIndex";

  private final TagRegistry registry;
  private final RemoteStore remoteStore;
  private final LogicExecutor executor;
  private final CacheMetricsCollector metrics;
  private final String tagKeyPrefix;
  private final Duration grace;

  public TagIndex(
      TagRegistry registry,
      RemoteStore remoteStore,
      LogicExecutor executor,
      CacheMetricsCollector metrics,
      String keyPrefix,
      Duration grace) {
    this.registry = registry;
    this.remoteStore = remoteStore;
    this.executor = executor;
    this.metrics = metrics;
    this.tagKeyPrefix = keyPrefix + "tag:";
    this.grace = grace;
  }

  public String tagSetKey(String tag) {
    return tagKeyPrefix + tag;
  }

  /**
   * Registers {@code key} under every tag.
   *
   * @return false when at least one remote registration degraded (the local one always succeeds)
   */
  public boolean track(String key, Collection<String> tags, Duration ttl) {
    if (tags == null || tags.isEmpty()) {
      return true;
    }
    registry.register(key, tags);

    Duration setTtl = ttl.plus(grace);
    boolean allRemote = true;
    for (String tag : tags) {
      String setKey = tagSetKey(tag);
      boolean ok =
          executor.executeOrDefault(
              () -> {
                remoteStore.addToSet(setKey, key);
                remoteStore.expire(setKey, setTtl);
                return true;
              },
              false,
              TaskContext.of(COMPONENT, "Track", setKey));
      if (!ok) {
        allRemote = false;
        metrics.recordL2Failure();
        log.warn("[TagIndex] Remote tag registration degraded: tag={}, key={}", tag, key);
      }
    }
    return allRemote;
  }

  /** Registers {@code key} as a dependent of each parent key. */
  public boolean dependOn(String key, Collection<String> parentKeys, Duration ttl) {
    if (parentKeys == null || parentKeys.isEmpty()) {
      return true;
    }
    List<String> dependencyTags = new ArrayList<>(parentKeys.size());
    for (String parent : parentKeys) {
      dependencyTags.add(TagRegistry.dependencyTag(parent));
    }
    return track(key, dependencyTags, ttl);
  }

  /**
   * Atomically enumerates and removes the tag's remote set, then merges and clears the local
   * registration.
   *
   * @return every key registered under the tag in either scope
   */
  public Set<String> drain(String tag) {
    String setKey = tagSetKey(tag);
    Set<String> remote =
        executor.executeOrDefault(
            () -> remoteStore.drainSet(setKey), null, TaskContext.of(COMPONENT, "Drain", setKey));
    if (remote == null) {
      metrics.recordL2Failure();
      log.warn("[TagIndex] Remote drain degraded, using local registry only: tag={}", tag);
    }

    Set<String> keys = new LinkedHashSet<>(registry.removeTag(tag));
    if (remote != null) {
      keys.addAll(remote);
    }
    log.debug("[TagIndex] Drained tag={} -> {} keys", tag, keys.size());
    return keys;
  }

  /** Dependents registered directly under {@code parentKey}, drained like any tag. */
  public Set<String> drainDependents(String parentKey) {
    return drain(TagRegistry.dependencyTag(parentKey));
  }

  /**
   * Drops local edges of a key that left L1 (deleted, evicted or expired). Remote set entries are
   * left to expire with the set; a stale member is a tolerated miss on the next drain.
   */
  public void untrack(String key) {
    registry.removeKey(key);
  }

  /** Forgets every local edge; the remote sets still cover the keys. */
  public void clearLocal() {
    registry.clear();
  }

  public int localTagCount() {
    return registry.tagCount();
  }
}
