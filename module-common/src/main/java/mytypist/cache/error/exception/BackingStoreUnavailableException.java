package mytypist.cache.error.exception;

import mytypist.cache.error.CacheErrorCode;
import mytypist.cache.error.exception.base.ServerBaseException;

/**
 * L2 backing store (Redis) connection or command failure.
 *
 * <p>Never reaches business code: reads degrade to a miss, writes are logged and skipped.
 */
public class BackingStoreUnavailableException extends ServerBaseException {

  public BackingStoreUnavailableException(String operation, Throwable cause) {
    super(CacheErrorCode.BACKING_STORE_UNAVAILABLE, cause, operation);
  }
}
