package ca.gc.cra.ratemetrics.application.rate;

import ca.gc.cra.ratemetrics.application.port.RateLogger;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Logging sites known to a pipeline, keyed by tag, together with the logger that reports their ticks.
 *
 * @param <K> tag type
 * @since 0.1.0
 */
public final class RateLoggerConfig<K> {
  private final Map<K, LoggerDetails> details;
  private final RateLogger<K> logger;

  private RateLoggerConfig(Map<K, LoggerDetails> details, RateLogger<K> logger) {
    this.details = Map.copyOf(Objects.requireNonNull(details, "details"));
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Creates a configuration.
   *
   * @param logger logger invoked on every tick
   * @param details logging sites by tag; copied
   * @param <K> tag type
   * @return immutable configuration
   */
  public static <K> RateLoggerConfig<K> of(RateLogger<K> logger, Map<K, LoggerDetails> details) {
    return new RateLoggerConfig<>(details, logger);
  }

  /**
   * Creates a configuration reporting through {@link InfoRateLogger}.
   *
   * @param details logging sites by tag; copied
   * @param <K> tag type
   * @return immutable configuration
   */
  public static <K> RateLoggerConfig<K> info(Map<K, LoggerDetails> details) {
    return new RateLoggerConfig<>(details, new InfoRateLogger<>());
  }

  /**
   * Looks up the details configured for {@code tag}.
   *
   * @param tag logging site
   * @return configured details
   * @throws IllegalArgumentException if no site is configured under {@code tag}
   */
  public LoggerDetails detailsFor(K tag) {
    LoggerDetails found = details.get(Objects.requireNonNull(tag, "tag"));
    if (found == null) {
      throw new IllegalArgumentException("No rate logger configured for tag " + tag);
    }
    return found;
  }

  public RateLogger<K> logger() {
    return logger;
  }

  public Set<K> tags() {
    return details.keySet();
  }

  /**
   * Reports {@code sample} events for {@code tag}.
   *
   * @param tag logging site
   * @param sample events since the previous report
   */
  public void report(K tag, long sample) {
    logger.log(detailsFor(tag), tag, sample);
  }
}
