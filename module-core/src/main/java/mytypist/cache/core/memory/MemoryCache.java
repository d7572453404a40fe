package mytypist.cache.core.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.core.domain.model.CacheEntry;
import mytypist.cache.core.domain.model.EncodedValue;

/**
 * In-process L1 cache.
 *
 * <h4>Policy</h4>
 *
 * <ul>
 *   <li>Capacity bound: at {@code maxEntries} the least-recently-accessed key is evicted before a
 *       new key is inserted (access order, not insertion order)
 *   <li>Lazy expiry: an expired entry is purged when it is next touched; there is no sweeper
 *   <li>One {@link ReentrantLock} guards the map and its LRU order; it is never held across I/O or
 *       listener callbacks
 * </ul>
 *
 * <h4>Write stamps</h4>
 *
 * <p>Every {@code put}, {@code delete} and {@code clear} advances a write sequence, recorded per
 * key stripe. A reader that fetched a value from L2 promotes it with {@link #putIfUnchangedSince}
 * using the {@link #writeStamp()} it took before the round trip; the promotion is dropped when the
 * key's stripe was written in between. Stripes keep this bounded whatever the key count; a
 * collision only costs a skipped promotion.
 *
 * <p>Entries hold encoded bytes, so every reader decodes its own copy.
 */
@Slf4j
public class MemoryCache {

  private static final int STRIPES = 1024;

  private final int maxEntries;
  private final Duration defaultTtl;
  private final Clock clock;
  private final EvictionListener evictionListener;

  private final ReentrantLock lock = new ReentrantLock();

  // accessOrder=true: iteration starts at the least recently accessed key
  private final LinkedHashMap<String, CacheEntry> entries;

  private final long[] lastWriteByStripe = new long[STRIPES];
  private long writeSequence;
  private long lastClear;

  public MemoryCache(int maxEntries, Duration defaultTtl) {
    this(maxEntries, defaultTtl, Clock.systemUTC(), EvictionListener.NO_OP);
  }

  public MemoryCache(
      int maxEntries, Duration defaultTtl, Clock clock, EvictionListener evictionListener) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    this.maxEntries = maxEntries;
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.evictionListener = Objects.requireNonNull(evictionListener, "evictionListener");
    this.entries = new LinkedHashMap<>(16, 0.75f, true);
  }

  public Optional<CacheEntry> get(String key) {
    Instant now = clock.instant();
    lock.lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (!entry.isExpired(now)) {
        return Optional.of(entry);
      }
      entries.remove(key);
    } finally {
      lock.unlock();
    }

    log.trace("[MemoryCache] Expired on access: key={}", key);
    evictionListener.onExpiry(key);
    return Optional.empty();
  }

  /** Current write sequence; pass it back to {@link #putIfUnchangedSince}. */
  public long writeStamp() {
    lock.lock();
    try {
      return writeSequence;
    } finally {
      lock.unlock();
    }
  }

  public void put(String key, EncodedValue value) {
    put(key, value, defaultTtl);
  }

  public void put(String key, EncodedValue value, Duration ttl) {
    store(key, value, ttl, Long.MAX_VALUE);
  }

  /**
   * Stores the entry only if neither {@code key} nor the whole cache was written after {@code
   * stamp} was taken.
   *
   * @return false when a newer write won and the entry was dropped
   */
  public boolean putIfUnchangedSince(String key, EncodedValue value, Duration ttl, long stamp) {
    return store(key, value, ttl, stamp);
  }

  private boolean store(String key, EncodedValue value, Duration ttl, long stamp) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Duration effective = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
    CacheEntry entry = CacheEntry.create(value, clock.instant(), effective);

    String evicted = null;
    lock.lock();
    try {
      if (lastClear > stamp || lastWriteByStripe[stripe(key)] > stamp) {
        return false;
      }
      if (!entries.containsKey(key) && entries.size() >= maxEntries) {
        evicted = evictEldest();
      }
      entries.put(key, entry);
      markWritten(key);
    } finally {
      lock.unlock();
    }

    if (evicted != null) {
      log.debug("[MemoryCache] LRU eviction: key={}", evicted);
      evictionListener.onEviction(evicted);
    }
    return true;
  }

  /**
   * Idempotent removal.
   *
   * @return whether a live or expired entry was actually removed
   */
  public boolean delete(String key) {
    lock.lock();
    try {
      markWritten(key);
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
      lastClear = ++writeSequence;
    } finally {
      lock.unlock();
    }
  }

  /** Number of stored entries, including expired ones not yet touched. */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxEntries() {
    return maxEntries;
  }

  // caller holds the lock
  private void markWritten(String key) {
    lastWriteByStripe[stripe(key)] = ++writeSequence;
  }

  private static int stripe(String key) {
    int h = key.hashCode();
    return (h ^ (h >>> 16)) & (STRIPES - 1);
  }

  // caller holds the lock
  private String evictEldest() {
    Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
    if (!it.hasNext()) {
      return null;
    }
    String eldest = it.next().getKey();
    it.remove();
    return eldest;
  }
}
