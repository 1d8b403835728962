package ca.gc.cra.ratemetrics.application.port;

import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;

/**
 * <strong>What:</strong> Port receiving the number of events observed during one sampling tick.
 * <p><strong>Why:</strong> Lets stream taps and rate gauges report counts without knowing whether they end up in
 * log lines, Prometheus gauges, or both.</p>
 * <p><strong>Role:</strong> Implemented by {@code InfoRateLogger}; test doubles record invocations.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from timer threads and pipeline threads.</p>
 *
 * @param <K> tag type identifying the logging site
 * @since 0.1.0
 */
@FunctionalInterface
public interface RateLogger<K> {
  /**
   * Reports one tick.
   *
   * @param details configuration of the logging site
   * @param tag site identifier the tick belongs to
   * @param sample events observed since the previous tick; never negative
   */
  void log(LoggerDetails details, K tag, long sample);
}
