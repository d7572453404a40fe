package mytypist.cache.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mytypist.cache.common.function.ThrowingSupplier;
import mytypist.cache.error.exception.base.ClientBaseException;
import mytypist.cache.infrastructure.executor.function.ThrowingRunnable;
import mytypist.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Default {@link LogicExecutor}.
 *
 * <ul>
 *   <li><b>Error rethrow</b>: VirtualMachineError and friends propagate without translation
 *   <li><b>Translation</b>: every other failure goes through the injected translator (or the
 *       caller's, for {@link #executeWithTranslation})
 *   <li><b>Logging</b>: propagated client errors at DEBUG, other propagated failures at WARN;
 *       recovered failures at DEBUG (the caller owns the degradation log)
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(translator, t, context);
      logFailure(primary, context);
      throw primary;
    }
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(translator, t, context);
      log.debug("[LogicExecutor] {} recovered: {}", context.toTaskName(), translated.toString());
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");

    Throwable primary = null;
    try {
      return execute(task, context);
    } catch (RuntimeException | Error e) {
      primary = e;
      throw e;
    } finally {
      runCleanup(primary, finallyBlock);
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(customTranslator, t, context);
      logFailure(primary, context);
      throw primary;
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      log.debug("[LogicExecutor] {} failed, falling back: {}", context.toTaskName(), t.toString());
      return fallback.apply(t);
    }
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator translator, Throwable t, TaskContext context) {
    try {
      return translator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error e) {
      throw e;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static void logFailure(RuntimeException e, TaskContext context) {
    if (e instanceof ClientBaseException) {
      log.debug("[LogicExecutor] {} rejected: {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.warn("[LogicExecutor] {} failed: {}", context.toTaskName(), e.getMessage(), e);
  }

  // cleanup failure never hides the primary exception
  private static void runCleanup(Throwable primary, Runnable finallyBlock) {
    try {
      finallyBlock.run();
    } catch (RuntimeException cleanupEx) {
      if (primary == null) {
        throw cleanupEx;
      }
      if (primary != cleanupEx) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }
}
