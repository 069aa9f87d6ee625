package ca.gc.cra.warden.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors used by the inquiry use case.
 */
public final class ExecutorFactories {
  /** Queued fetches per worker before callers start running fetches themselves. */
  static final int QUEUE_PER_WORKER = 64;

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for inquiry fan-out fetches.
   *
   * <p>Workers are daemon threads so an abandoned pool never blocks JVM exit. When the queue is full the
   * submitting thread runs the fetch itself, which throttles callers instead of rejecting requests. Once the
   * pool is shut down every submission is rejected with {@link RejectedExecutionException}.</p>
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread-name prefix; blank defaults to {@code warden-fanout}
   * @param handler uncaught exception handler installed on each worker; {@code null} ignores
   * @return configured executor service, owned by the caller
   */
  public static ExecutorService newFanOutPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "warden-fanout" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(size * QUEUE_PER_WORKER),
        factory,
        new CallerRunsUnlessShutdown());
  }

  /**
   * Shuts a pool down, waiting up to {@code timeoutMillis} before interrupting remaining work.
   *
   * @param executor pool to stop; {@code null} is ignored
   * @param timeoutMillis grace period in milliseconds
   * @return {@code true} when the pool terminated within the grace period
   * @throws InterruptedException if interrupted while waiting
   */
  public static boolean shutdownGracefully(ExecutorService executor, long timeoutMillis)
      throws InterruptedException {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
      return true;
    }
    executor.shutdownNow();
    return false;
  }

  /** Runs overflow on the submitting thread; rejects outright once the pool is shut down. */
  static final class CallerRunsUnlessShutdown implements RejectedExecutionHandler {
    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
      if (executor.isShutdown()) {
        throw new RejectedExecutionException("fan-out pool is shut down");
      }
      task.run();
    }
  }
}
