package ca.gc.cra.ratemetrics.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void tickerThreadsAreNamedDaemons() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newTickerScheduler("gauge");
    try {
      AtomicReference<Thread> worker = new AtomicReference<>();
      scheduler.schedule(() -> worker.set(Thread.currentThread()), 0, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);

      assertTrue(worker.get().isDaemon());
      assertTrue(worker.get().getName().startsWith("gauge-"));
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newTickerScheduler(" ");
    try {
      String name = scheduler.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

      assertTrue(name.startsWith("ratemetrics-ticker-"), name);
    } finally {
      scheduler.shutdownNow();
    }
  }
}
