package mytypist.cache.infrastructure.executor.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
