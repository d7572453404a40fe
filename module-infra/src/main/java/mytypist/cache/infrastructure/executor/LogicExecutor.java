package mytypist.cache.infrastructure.executor;

import java.util.function.Function;
import mytypist.cache.common.function.ThrowingSupplier;
import mytypist.cache.infrastructure.executor.function.ThrowingRunnable;
import mytypist.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Execution template that replaces scattered try-catch blocks.
 *
 * <h3>Patterns</h3>
 *
 * <ul>
 *   <li>{@link #execute}: run and rethrow a translated exception
 *   <li>{@link #executeOrDefault}: degrade to a default value (L2 reads, best-effort writes)
 *   <li>{@link #executeOrCatch}: recover from the translated exception
 *   <li>{@link #executeVoid}: side effect only
 *   <li>{@link #executeWithFinally}: cleanup that runs exactly once
 *   <li>{@link #executeWithTranslation}: translate with a dedicated {@link ExceptionTranslator}
 *   <li>{@link #executeWithFallback}: recover from the original, untranslated exception
 * </ul>
 *
 * <p>{@link Error}s are never translated, recovered from or swallowed.
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
