package mytypist.cache.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.ObjectStreamException;
import mytypist.cache.error.exception.BackingStoreUnavailableException;
import mytypist.cache.error.exception.DecodeException;
import mytypist.cache.error.exception.InternalCacheException;
import mytypist.cache.error.exception.SerializationException;
import mytypist.cache.error.exception.base.BaseException;
import mytypist.cache.infrastructure.executor.TaskContext;
import mytypist.cache.util.ExceptionUtils;

/** Strategy that turns a raw failure into a cache exception. */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e original failure
   * @param context task context
   * @return translated exception
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Decorator applied by every factory below.
   *
   * <ol>
   *   <li>Error: rethrown immediately
   *   <li>CompletionException/ExecutionException: unwrapped to the cause
   *   <li>BaseException: passed through untouched
   *   <li>anything else: handed to {@code inner}
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** Every Redis failure (connection, timeout, script error) becomes BackingStoreUnavailable. */
  static ExceptionTranslator forBackingStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          ExceptionUtils.restoreInterruptIfNeeded(unwrapped);
          return new BackingStoreUnavailableException(context.toTaskName(), unwrapped);
        });
  }

  /**
   * Encode failures belong to the caller's value, so they surface as SerializationException. The
   * context's dynamic value carries the key.
   */
  static ExceptionTranslator forSerialization(Object value) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new SerializationException(context.dynamicValue(), value, unwrapped));
  }

  static ExceptionTranslator forDecode() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException
              || unwrapped instanceof ObjectStreamException
              || unwrapped instanceof ClassNotFoundException) {
            return new DecodeException(
                "body decoding failed [" + context.toTaskName() + "]: " + unwrapped.getMessage(),
                unwrapped);
          }
          if (unwrapped instanceof IOException) {
            return new DecodeException(
                "payload I/O failed [" + context.toTaskName() + "]: " + unwrapped.getMessage(),
                unwrapped);
          }
          return new DecodeException(context.toTaskName(), unwrapped);
        });
  }

  /** Default translator: anything that is not already a cache exception is internal. */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          ExceptionUtils.restoreInterruptIfNeeded(unwrapped);
          return new InternalCacheException(context.toTaskName(), unwrapped);
        });
  }
}
