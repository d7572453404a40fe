package mytypist.cache.error.exception;

import mytypist.cache.error.CacheErrorCode;
import mytypist.cache.error.exception.base.ServerBaseException;

/** Stored bytes are corrupt or carry an unknown format tag. Read paths treat it as a miss. */
public class DecodeException extends ServerBaseException {

  public DecodeException(String detail) {
    super(CacheErrorCode.CACHE_DECODE_FAILED, detail);
  }

  public DecodeException(String detail, Throwable cause) {
    super(CacheErrorCode.CACHE_DECODE_FAILED, cause, detail);
  }
}
