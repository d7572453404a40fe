package mytypist.cache.error.exception;

import mytypist.cache.error.CacheErrorCode;
import mytypist.cache.error.exception.base.ServerBaseException;

public class InternalCacheException extends ServerBaseException {

  public InternalCacheException(String taskName, Throwable cause) {
    super(CacheErrorCode.INTERNAL_CACHE_ERROR, cause, taskName);
  }
}
