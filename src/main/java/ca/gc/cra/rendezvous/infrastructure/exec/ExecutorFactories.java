package ca.gc.cra.rendezvous.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the server's threads: Netty event loops and the housekeeping scheduler.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing named threads, suitable for Netty event loop groups.
   *
   * @param prefix thread-name prefix; blank falls back to {@code rendezvous}
   * @param daemon whether threads are daemon threads
   * @return thread factory numbering threads from zero
   */
  public static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "rendezvous" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }

  /**
   * Builds a single-threaded daemon scheduler for periodic maintenance such as limiter sweeps.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler; {@code null} logs at ERROR
   * @return scheduler that drops delayed tasks on shutdown
   */
  public static ScheduledExecutorService newHousekeepingScheduler(String prefix, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    ThreadFactory base = namedThreadFactory(prefix, true);
    ThreadFactory factory = runnable -> {
      Thread thread = base.newThread(runnable);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }
}
