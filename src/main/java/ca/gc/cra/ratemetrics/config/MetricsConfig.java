package ca.gc.cra.ratemetrics.config;

import ca.gc.cra.ratemetrics.application.port.RateLogger;
import ca.gc.cra.ratemetrics.application.rate.RateLoggerConfig;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import ca.gc.cra.ratemetrics.infrastructure.metrics.MetricRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of a metrics configuration file: the scrape endpoint and the rate logging sites.
 *
 * @param server scrape endpoint address
 * @param loggers logging sites keyed by name, in file order
 * @since 0.1.0
 */
public record MetricsConfig(MetricsServerConfig server, Map<String, RateLoggerDefinition> loggers) {

  public MetricsConfig {
    Objects.requireNonNull(server, "server");
    loggers = Collections.unmodifiableMap(new LinkedHashMap<>(loggers));
  }

  /**
   * Registers every site's metrics and returns a configuration keyed by site name.
   *
   * @param registry registry receiving the metrics
   * @param logger logger reporting ticks
   * @return rate logger configuration
   * @throws IllegalArgumentException if two sites share a metric name
   */
  public RateLoggerConfig<String> rateLoggerConfig(MetricRegistry registry, RateLogger<String> logger) {
    Map<String, LoggerDetails> details = new LinkedHashMap<>();
    for (Map.Entry<String, RateLoggerDefinition> entry : loggers.entrySet()) {
      details.put(entry.getKey(), entry.getValue().toDetails(registry));
    }
    return RateLoggerConfig.of(logger, details);
  }
}
