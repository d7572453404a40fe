package mytypist.cache.infrastructure.cache.invalidation;

import java.util.List;

/**
 * L1 invalidation message exchanged between instances sharing one Redis.
 *
 * <p>L2 is shared, so only the per-process L1 copies need the broadcast.
 *
 * @param keys physical keys to drop (empty for {@link InvalidationType#CLEAR_ALL})
 * @param sourceInstanceId publishing instance, used to skip self-published events
 * @param type EVICT or CLEAR_ALL
 * @param timestamp publish time in epoch millis
 */
public record CacheInvalidationEvent(
    List<String> keys, String sourceInstanceId, InvalidationType type, long timestamp) {

  public CacheInvalidationEvent {
    keys = keys == null ? List.of() : List.copyOf(keys);
  }

  public static CacheInvalidationEvent evict(List<String> keys, String instanceId) {
    return new CacheInvalidationEvent(
        keys, instanceId, InvalidationType.EVICT, System.currentTimeMillis());
  }

  public static CacheInvalidationEvent clearAll(String instanceId) {
    return new CacheInvalidationEvent(
        List.of(), instanceId, InvalidationType.CLEAR_ALL, System.currentTimeMillis());
  }
}
