package ca.gc.cra.ratemetrics.application.rate;

import ca.gc.cra.ratemetrics.application.port.RateLogger;
import ca.gc.cra.ratemetrics.domain.metrics.LogSettings;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import ca.gc.cra.ratemetrics.domain.metrics.MetricTarget;
import ca.gc.cra.ratemetrics.domain.metrics.Metrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts a tick's event count into counter deltas, per-second gauge values, and an INFO
 * rate line.
 * <p><strong>Role:</strong> Default {@link RateLogger} behind stream taps and rate gauges.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Add the transformed sample to every configured counter.</li>
 *   <li>Set every configured gauge to the transformed sample divided by the interval.</li>
 *   <li>Log {@code "<tag> <action> at the rate of <rate> <unit>/sec"} on the logger named by the label.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; concurrency guarantees come from the Prometheus client.</p>
 * <p><strong>Errors:</strong> Every entry is attempted even when an earlier one fails. Counter rejections are
 * handled per {@code CounterFailurePolicy} once the tick was processed; exceptions thrown by update functions or
 * the client are rethrown afterwards, the first one carrying the others as suppressed. Under {@code FAIL} they are
 * attached to the {@link CounterUpdateException} instead.</p>
 *
 * @param <K> tag type; not used when formatting, the line uses {@link LoggerDetails#tag()}
 * @since 0.1.0
 */
public final class InfoRateLogger<K> implements RateLogger<K> {
  private static final Logger log = LoggerFactory.getLogger(InfoRateLogger.class);

  @Override
  public void log(LoggerDetails details, K tag, long sample) {
    Objects.requireNonNull(details, "details");
    if (sample < 0) {
      throw new IllegalArgumentException("sample must not be negative (was " + sample + ")");
    }
    double value = sample;
    double intervalSecs = details.intervalSecs();

    List<String> rejected = new ArrayList<>();
    List<RuntimeException> failures = new ArrayList<>();
    for (MetricTarget target : details.metrics().targets()) {
      try {
        update(target, value, intervalSecs, rejected);
      } catch (RuntimeException ex) {
        failures.add(ex);
      }
    }

    LogSettings settings = details.log();
    if (settings.enabled()) {
      try {
        double rate = settings.update().applyAsDouble(value) / intervalSecs;
        LoggerFactory.getLogger(details.label())
            .info("{} {} at the rate of {} {}/sec", details.tag(), details.action(), rate, details.unit());
      } catch (RuntimeException ex) {
        failures.add(ex);
      }
    }

    if (!rejected.isEmpty()) {
      handleRejected(details, rejected, failures);
    }
    if (!failures.isEmpty()) {
      throw withSuppressed(failures.get(0), failures.subList(1, failures.size()));
    }
  }

  private static void update(MetricTarget target, double value, double intervalSecs, List<String> rejected) {
    double transformed = target.transform(value);
    if (target instanceof MetricTarget.CounterTarget counterTarget) {
      if (!Metrics.addCounter(counterTarget.counter(), transformed)) {
        rejected.add(Metrics.nameOf(counterTarget.counter()) + "=" + transformed);
      }
    } else if (target instanceof MetricTarget.GaugeTarget gaugeTarget) {
      Metrics.setGauge(gaugeTarget.gauge(), transformed / intervalSecs);
    }
  }

  private static RuntimeException withSuppressed(RuntimeException primary, List<RuntimeException> others) {
    for (RuntimeException other : others) {
      primary.addSuppressed(other);
    }
    return primary;
  }

  private static void handleRejected(
      LoggerDetails details, List<String> rejected, List<RuntimeException> failures) {
    switch (details.counterFailurePolicy()) {
      case IGNORE -> {
        // dropped on request
      }
      case WARN -> {
        for (String entry : rejected) {
          log.warn("Counter rejected rate delta for {}: {}", details.tag(), entry);
        }
      }
      case FAIL -> throw withSuppressed(new CounterUpdateException(details.tag(), rejected), failures);
    }
  }
}
