package ca.gc.cra.ratemetrics.infrastructure.exec;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the timer threads driving rate gauges.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for sampling ticks.
   *
   * <p>Threads are daemons so an unclosed gauge never keeps the JVM alive; cancelled ticks are removed from the
   * queue immediately.</p>
   *
   * <p>Periodic tasks run inside futures, so task exceptions never reach the thread; tasks log their own
   * failures.</p>
   *
   * @param prefix thread-name prefix used to tag timer threads
   * @return configured scheduler
   */
  public static ScheduledExecutorService newTickerScheduler(String prefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "ratemetrics-ticker" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };

    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }
}
