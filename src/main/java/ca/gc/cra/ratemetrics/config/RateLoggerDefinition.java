package ca.gc.cra.ratemetrics.config;

import ca.gc.cra.ratemetrics.domain.metrics.CounterFailurePolicy;
import ca.gc.cra.ratemetrics.domain.metrics.LogSettings;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import ca.gc.cra.ratemetrics.domain.metrics.MetricDetails;
import ca.gc.cra.ratemetrics.infrastructure.metrics.MetricRegistry;
import java.util.List;
import java.util.Objects;

/**
 * Rate logging site as written in a configuration file, with its counters and gauges referenced by name.
 *
 * @param name key of the site in the {@code loggers} section
 * @param label SLF4J logger name for the rate line
 * @param tag subject printed at the start of the rate line
 * @param unit unit printed before {@code /sec}
 * @param action verb printed after the tag
 * @param intervalSecs sampling interval in seconds
 * @param logEnabled whether the rate line is logged
 * @param counterFailurePolicy reaction to rejected counter deltas
 * @param counterNames counters to create and feed, in order
 * @param gaugeNames gauges to create and feed, in order
 * @since 0.1.0
 */
public record RateLoggerDefinition(
    String name,
    String label,
    String tag,
    String unit,
    String action,
    double intervalSecs,
    boolean logEnabled,
    CounterFailurePolicy counterFailurePolicy,
    List<String> counterNames,
    List<String> gaugeNames) {

  public RateLoggerDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(counterFailurePolicy, "counterFailurePolicy");
    counterNames = List.copyOf(counterNames);
    gaugeNames = List.copyOf(gaugeNames);
  }

  /**
   * Registers the referenced counters and gauges and builds the matching details.
   *
   * @param registry registry receiving the metrics
   * @return validated details
   * @throws IllegalArgumentException if a metric name is already registered or the interval is invalid
   */
  public LoggerDetails toDetails(MetricRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    MetricDetails.Builder metrics = MetricDetails.builder();
    for (String counterName : counterNames) {
      metrics.counter(registry.registerCounter(counterName, "Events counted by rate logger " + name));
    }
    for (String gaugeName : gaugeNames) {
      metrics.gauge(registry.registerGauge(gaugeName, "Per-second rate reported by rate logger " + name));
    }
    return LoggerDetails.builder()
        .label(label)
        .tag(tag)
        .unit(unit)
        .action(action)
        .intervalSecs(intervalSecs)
        .log(logEnabled ? LogSettings.on() : LogSettings.off())
        .metrics(metrics.build())
        .counterFailurePolicy(counterFailurePolicy)
        .build();
  }
}
