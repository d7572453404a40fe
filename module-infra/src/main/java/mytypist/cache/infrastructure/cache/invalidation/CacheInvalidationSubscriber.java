package mytypist.cache.infrastructure.cache.invalidation;

import java.util.function.Consumer;

/** Receives L1 invalidation events published by other instances. */
public interface CacheInvalidationSubscriber {

  CacheInvalidationSubscriber NO_OP =
      new CacheInvalidationSubscriber() {
        @Override
        public void subscribe(Consumer<CacheInvalidationEvent> handler) {}

        @Override
        public void unsubscribe() {}
      };

  /**
   * Starts delivering events from other instances to {@code handler}. Self-published events are
   * filtered out before the handler sees them.
   */
  void subscribe(Consumer<CacheInvalidationEvent> handler);

  void unsubscribe();
}
