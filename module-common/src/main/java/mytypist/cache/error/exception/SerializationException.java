package mytypist.cache.error.exception;

import mytypist.cache.error.CacheErrorCode;
import mytypist.cache.error.exception.base.ClientBaseException;

/**
 * The value itself cannot be cached: it is neither a JSON tree nor {@link java.io.Serializable}.
 *
 * <p>Propagates to the caller of {@code set}/{@code mset}.
 */
public class SerializationException extends ClientBaseException {

  public SerializationException(String key, Object value) {
    super(CacheErrorCode.CACHE_SERIALIZATION_FAILED, key, typeName(value));
  }

  public SerializationException(String key, Object value, Throwable cause) {
    super(CacheErrorCode.CACHE_SERIALIZATION_FAILED, cause, key, typeName(value));
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
