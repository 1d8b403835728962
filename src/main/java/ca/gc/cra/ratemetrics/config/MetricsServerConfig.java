package ca.gc.cra.ratemetrics.config;

import ca.gc.cra.ratemetrics.validation.Numbers;
import ca.gc.cra.ratemetrics.validation.Strings;

/**
 * Address the metrics scrape endpoint binds to.
 *
 * @param host interface to bind; {@code 0.0.0.0} for all
 * @param port TCP port; {@code 0} picks an ephemeral port
 * @since 0.1.0
 */
public record MetricsServerConfig(String host, int port) {
  /** Port used when nothing is configured. */
  public static final int DEFAULT_PORT = 9090;
  /** Host used when nothing is configured. */
  public static final String DEFAULT_HOST = "0.0.0.0";

  static final String PORT_PROPERTY = "ratemetrics.metrics.port";
  static final String PORT_ENV = "RATEMETRICS_METRICS_PORT";
  static final String HOST_PROPERTY = "ratemetrics.metrics.host";
  static final String HOST_ENV = "RATEMETRICS_METRICS_HOST";

  public MetricsServerConfig {
    host = Strings.requireNonBlank("host", host);
    Numbers.requireRange("port", port, 0, 65_535);
  }

  public static MetricsServerConfig ofPort(int port) {
    return new MetricsServerConfig(DEFAULT_HOST, port);
  }

  public static MetricsServerConfig defaults() {
    return new MetricsServerConfig(DEFAULT_HOST, DEFAULT_PORT);
  }

  /**
   * Resolves host and port from system properties, then environment variables, then defaults.
   *
   * @return resolved configuration
   * @throws IllegalArgumentException if the port is not a number in {@code [0, 65535]}
   */
  public static MetricsServerConfig fromEnvironment() {
    return fromEnvironment(defaults());
  }

  /**
   * Resolves host and port from system properties, then environment variables, then {@code fallback}.
   *
   * @param fallback values used when neither a property nor a variable is set, e.g. from a YAML file
   * @return resolved configuration
   * @throws IllegalArgumentException if the port is not a number in {@code [0, 65535]}
   */
  public static MetricsServerConfig fromEnvironment(MetricsServerConfig fallback) {
    String host = firstNonBlank(System.getProperty(HOST_PROPERTY), System.getenv(HOST_ENV), fallback.host());
    String rawPort = firstNonBlank(
        System.getProperty(PORT_PROPERTY), System.getenv(PORT_ENV), Integer.toString(fallback.port()));
    return new MetricsServerConfig(host, parsePort(rawPort));
  }

  static int parsePort(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be a number (was '" + raw + "')", ex);
    }
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }
}
