package mytypist.cache.error.exception.base;

import mytypist.cache.error.ErrorCode;

/**
 * ServerBaseException: infrastructure or data faults inside the cache. The cache degrades to a miss
 * or a best-effort write when one of these occurs; they carry enough detail for the logs.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // keep the real cause for debugging
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
