package mytypist.cache.error.exception;

import mytypist.cache.error.CacheErrorCode;
import mytypist.cache.error.exception.base.ClientBaseException;

public class InvalidCacheArgumentException extends ClientBaseException {

  public InvalidCacheArgumentException(String detail) {
    super(CacheErrorCode.INVALID_CACHE_ARGUMENT, detail);
  }
}
