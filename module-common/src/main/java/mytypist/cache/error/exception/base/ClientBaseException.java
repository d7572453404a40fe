package mytypist.cache.error.exception.base;

import mytypist.cache.error.ErrorCode;

/**
 * ClientBaseException: the caller handed the cache something it cannot work with. These are
 * programmer errors, not transient faults, so they are the only failures the cache lets surface.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
