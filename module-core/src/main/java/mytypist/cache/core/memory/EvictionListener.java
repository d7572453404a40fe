package mytypist.cache.core.memory;

/** Notified when L1 drops an entry on its own. Called outside the L1 lock. */
@FunctionalInterface
public interface EvictionListener {

  EvictionListener NO_OP = key -> {};

  /** The key was dropped to make room. */
  void onEviction(String key);

  /** The key was found expired on access and purged. */
  default void onExpiry(String key) {}
}
