package mytypist.cache.infrastructure.cache.invalidation;

/** What a remote instance should drop from its L1. */
public enum InvalidationType {

  /** the listed keys */
  EVICT,

  /** everything */
  CLEAR_ALL
}
