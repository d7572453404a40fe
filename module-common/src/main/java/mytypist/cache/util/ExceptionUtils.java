package mytypist.cache.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception unwrapping utilities.
 *
 * <p>Redisson's sync facade rethrows async failures wrapped in CompletionException; translators
 * need the root cause to classify them.
 */
public final class ExceptionUtils {

  /**
   * Unwrap async exception wrappers to find the root cause.
   *
   * <p>Unwraps: CompletionException, ExecutionException
   *
   * @param throwable The exception to unwrap
   * @return The root cause, or the original if not wrapped
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  /** Restores the interrupt flag when the given failure (or its cause chain) was an interrupt. */
  public static void restoreInterruptIfNeeded(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        return;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
  }

  private ExceptionUtils() {
    // Utility class
  }
}
