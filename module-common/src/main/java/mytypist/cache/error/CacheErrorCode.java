package mytypist.cache.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CacheErrorCode implements ErrorCode {
  // === Client Errors (caller supplied something the cache cannot hold) ===
  INVALID_CACHE_ARGUMENT("C001", "Invalid cache argument: %s"),
  CACHE_SERIALIZATION_FAILED("C002", "Value cannot be cached (key: %s, type: %s)"),

  // === Server Errors ===
  INTERNAL_CACHE_ERROR("S001", "Internal cache error (%s)"),
  CACHE_DECODE_FAILED("S002", "Stored payload cannot be decoded (%s)"),
  BACKING_STORE_UNAVAILABLE("S003", "Backing store unavailable (%s)");

  private final String code;
  private final String message;
}
