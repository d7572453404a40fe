package mytypist.cache.core.tag;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local tag index: {@code tag -> keys} and the reverse {@code key -> tags}.
 *
 * <p>A per-process accelerator only; the remote tag sets are authoritative across processes. Both
 * directions are updated together under one lock so they never disagree. Callers keep it in step
 * with L1 residency, so it never holds more keys than L1 can.
 *
 * <p>Dependencies are plain tags named {@link #dependencyTag(String)} of the parent key, so the
 * dependency graph is just another slice of this index. Cascades walk it tag by tag.
 */
public class TagRegistry {

  public static final String DEPENDENCY_TAG_PREFIX = "dep:";

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Set<String>> keysByTag = new HashMap<>();
  private final Map<String, Set<String>> tagsByKey = new HashMap<>();

  public static String dependencyTag(String parentKey) {
    return DEPENDENCY_TAG_PREFIX + parentKey;
  }

  public void register(String key, Collection<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return;
    }
    lock.lock();
    try {
      for (String tag : tags) {
        keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
        tagsByKey.computeIfAbsent(key, k -> new HashSet<>()).add(tag);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Removes the tag and returns the keys that were registered under it. */
  public Set<String> removeTag(String tag) {
    lock.lock();
    try {
      Set<String> keys = keysByTag.remove(tag);
      if (keys == null) {
        return Collections.emptySet();
      }
      for (String key : keys) {
        unlinkReverse(key, tag);
      }
      return keys;
    } finally {
      lock.unlock();
    }
  }

  /** Drops every edge that touches {@code key}. */
  public void removeKey(String key) {
    lock.lock();
    try {
      Set<String> tags = tagsByKey.remove(key);
      if (tags == null) {
        return;
      }
      for (String tag : tags) {
        Set<String> keys = keysByTag.get(tag);
        if (keys != null) {
          keys.remove(key);
          if (keys.isEmpty()) {
            keysByTag.remove(tag);
          }
        }
      }
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      keysByTag.clear();
      tagsByKey.clear();
    } finally {
      lock.unlock();
    }
  }

  public Set<String> keysFor(String tag) {
    lock.lock();
    try {
      Set<String> keys = keysByTag.get(tag);
      return keys == null ? Set.of() : Set.copyOf(keys);
    } finally {
      lock.unlock();
    }
  }

  public Set<String> tagsFor(String key) {
    lock.lock();
    try {
      Set<String> tags = tagsByKey.get(key);
      return tags == null ? Set.of() : Set.copyOf(tags);
    } finally {
      lock.unlock();
    }
  }

  public int tagCount() {
    lock.lock();
    try {
      return keysByTag.size();
    } finally {
      lock.unlock();
    }
  }

  // caller holds the lock
  private void unlinkReverse(String key, String tag) {
    Set<String> tags = tagsByKey.get(key);
    if (tags != null) {
      tags.remove(tag);
      if (tags.isEmpty()) {
        tagsByKey.remove(key);
      }
    }
  }
}
