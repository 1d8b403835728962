package ca.gc.cra.ratemetrics.infrastructure.metrics;

import ca.gc.cra.ratemetrics.application.port.RateGauge;
import ca.gc.cra.ratemetrics.application.rate.RateLoggerConfig;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import ca.gc.cra.ratemetrics.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.Spliterator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RateGauge} that counts elements as they pass and reports the count to the configured
 * rate logger every {@code intervalSecs}.
 * <p><strong>Lifecycle:</strong> The timer starts on the first pull. Once the source is exhausted the wrapped stream
 * keeps the timer running and blocks the next pull until the stream is closed; closing cancels the timer and closes
 * the source.</p>
 * <p><strong>Errors:</strong> A rate logger failure on the timer thread is logged at ERROR, stops the timer and is
 * rethrown to the consumer on its next pull, including a pull blocked after the end of the source.</p>
 * <p><strong>Thread-safety:</strong> One consumer thread per wrapped stream; the timer thread only touches the
 * counter and the failure slot.</p>
 *
 * @param <K> tag type
 * @since 0.1.0
 */
public final class ScheduledRateGauge<K> implements RateGauge<K>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScheduledRateGauge.class);

  private final RateLoggerConfig<K> config;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;

  /**
   * Creates a gauge with its own daemon timer thread, shut down by {@link #close()}.
   *
   * @param config logging sites and the logger reporting them
   */
  public ScheduledRateGauge(RateLoggerConfig<K> config) {
    this(config, ExecutorFactories.newTickerScheduler("ratemetrics-gauge"), true);
  }

  /**
   * Creates a gauge ticking on a caller-owned scheduler.
   *
   * @param config logging sites and the logger reporting them
   * @param scheduler scheduler running the ticks; not shut down by this gauge
   */
  public ScheduledRateGauge(RateLoggerConfig<K> config, ScheduledExecutorService scheduler) {
    this(config, scheduler, false);
  }

  private ScheduledRateGauge(
      RateLoggerConfig<K> config, ScheduledExecutorService scheduler, boolean ownsScheduler) {
    this.config = Objects.requireNonNull(config, "config");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.ownsScheduler = ownsScheduler;
  }

  @Override
  public <T> Stream<T> withRateGauge(K tag, Stream<T> source) {
    Objects.requireNonNull(source, "source");
    LoggerDetails details = config.detailsFor(tag);
    GaugedSpliterator<T> gauged = new GaugedSpliterator<>(source.spliterator(), tag, details);
    return StreamSupport.stream(gauged, false)
        .onClose(gauged::stop)
        .onClose(source::close);
  }

  @Override
  public void close() {
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private final class GaugedSpliterator<T> implements Spliterator<T> {
    private final Spliterator<T> upstream;
    private final K tag;
    private final LoggerDetails details;
    private final LongAdder observed = new LongAdder();
    private final CountDownLatch released = new CountDownLatch(1);
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private volatile ScheduledFuture<?> ticker;
    private volatile boolean stopped;
    private boolean exhausted;

    private GaugedSpliterator(Spliterator<T> upstream, K tag, LoggerDetails details) {
      this.upstream = upstream;
      this.tag = tag;
      this.details = details;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
      rethrowFailure();
      if (stopped) {
        return false;
      }
      startTicker();
      if (!exhausted) {
        boolean advanced = upstream.tryAdvance(element -> {
          observed.increment();
          action.accept(element);
        });
        if (advanced) {
          return true;
        }
        exhausted = true;
        log.debug("Source for rate gauge {} exhausted; waiting for close", tag);
      }
      awaitRelease();
      rethrowFailure();
      return false;
    }

    @Override
    public Spliterator<T> trySplit() {
      return null;
    }

    @Override
    public long estimateSize() {
      return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
      return ORDERED;
    }

    private void startTicker() {
      if (ticker != null) {
        return;
      }
      long periodNanos = Math.max(1L, Math.round(details.intervalSecs() * 1_000_000_000d));
      ticker = scheduler.scheduleAtFixedRate(this::tick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
      if (stopped) {
        ticker.cancel(false);
      }
    }

    private void tick() {
      long sample = observed.sumThenReset();
      try {
        config.logger().log(details, tag, sample);
      } catch (RuntimeException ex) {
        log.error("Rate logger failed for {}; stopping rate gauge", tag, ex);
        failure.compareAndSet(null, ex);
        released.countDown();
        throw ex;
      }
    }

    private void awaitRelease() {
      try {
        released.await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        stop();
      }
    }

    private void rethrowFailure() {
      RuntimeException ex = failure.get();
      if (ex != null) {
        stop();
        throw ex;
      }
    }

    private void stop() {
      stopped = true;
      ScheduledFuture<?> current = ticker;
      if (current != null) {
        current.cancel(false);
      }
      released.countDown();
    }
  }
}
