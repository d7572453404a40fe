package mytypist.cache.core.domain.model;

public enum CacheLayer {
  L1,
  L2;

  public String tagValue() {
    return name();
  }
}
