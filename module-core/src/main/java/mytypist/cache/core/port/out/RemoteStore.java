package mytypist.cache.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import mytypist.cache.core.domain.model.RemoteEntry;

/**
 * L2 backing store port.
 *
 * <h3>Contract</h3>
 *
 * <ul>
 *   <li>Values are opaque byte arrays stored with a millisecond TTL
 *   <li>Every operation may fail with {@link
 *       mytypist.cache.error.exception.BackingStoreUnavailableException}; callers decide whether a
 *       failure degrades to a miss or is logged and skipped
 *   <li>Bulk operations chunk internally; the caller passes any number of keys
 * </ul>
 *
 * <h3>Implementations</h3>
 *
 * <ul>
 *   <li>{@code RedissonRemoteStore} - Redis via Redisson
 *   <li>{@code DisabledRemoteStore} - L1-only mode (every read misses, every write is a no-op)
 * </ul>
 */
public interface RemoteStore {

  /** Value and remaining TTL of one key, read in a single round trip. */
  Optional<RemoteEntry> get(String key);

  /**
   * Pipelined variant of {@link #get(String)}.
   *
   * @return only the keys that were present
   */
  Map<String, RemoteEntry> getAll(Collection<String> keys);

  void set(String key, byte[] value, Duration ttl);

  /** Pipelined SET ... PX for every entry. */
  void setAll(Map<String, byte[]> entries, Duration ttl);

  /**
   * Deletes the given keys.
   *
   * @return the subset of keys that existed; its size is the deleted count
   */
  Set<String> delete(Collection<String> keys);

  void addToSet(String setKey, String member);

  Set<String> setMembers(String setKey);

  /**
   * Extends the TTL of a key. A deadline already further out is kept, so a short-lived member never
   * shortens the life of a set that still holds long-lived members.
   */
  void expire(String key, Duration ttl);

  /** Atomically reads every member of the set and deletes the set. */
  Set<String> drainSet(String setKey);

  boolean ping();

  /** Whether this store actually talks to a backend. */
  default boolean isEnabled() {
    return true;
  }
}
