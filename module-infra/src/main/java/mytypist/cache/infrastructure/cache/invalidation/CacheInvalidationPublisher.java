package mytypist.cache.infrastructure.cache.invalidation;

/**
 * Publishes L1 invalidation events to the other instances.
 *
 * <p>Best-effort: a lost message is bounded by the L1 TTL.
 */
@FunctionalInterface
public interface CacheInvalidationPublisher {

  CacheInvalidationPublisher NO_OP = event -> {};

  void publish(CacheInvalidationEvent event);
}
