package ca.gc.cra.ratemetrics.infrastructure.metrics;

import ca.gc.cra.ratemetrics.config.MetricsServerConfig;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves a {@link MetricRegistry} over HTTP in the Prometheus text exposition format.
 *
 * <p>The server runs on daemon threads until the process exits or {@link #close()} is called.</p>
 *
 * @since 0.1.0
 */
public final class MetricsServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

  private final HTTPServer server;

  private MetricsServer(HTTPServer server) {
    this.server = server;
  }

  /**
   * Binds the configured address and starts serving.
   *
   * @param config host and port; port {@code 0} picks an ephemeral port
   * @param registry registry to expose
   * @return running server
   * @throws UncheckedIOException if the address cannot be bound
   */
  public static MetricsServer start(MetricsServerConfig config, MetricRegistry registry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(registry, "registry");
    HTTPServer server;
    try {
      server = new HTTPServer.Builder()
          .withHostname(config.host())
          .withPort(config.port())
          .withRegistry(registry.collectorRegistry())
          .withDaemonThreads(true)
          .build();
    } catch (IOException ex) {
      throw new UncheckedIOException(
          "Failed to bind metrics server on " + config.host() + ":" + config.port(), ex);
    }
    log.info("Starting metrics server at http://localhost:{}/", server.getPort());
    return new MetricsServer(server);
  }

  /**
   * Starts a server on {@code port} for the default registry.
   *
   * @param port TCP port
   * @return running server
   */
  public static MetricsServer start(int port) {
    return start(MetricsServerConfig.ofPort(port), MetricRegistry.defaultRegistry());
  }

  /** Port actually bound, useful when an ephemeral port was requested. */
  public int port() {
    return server.getPort();
  }

  @Override
  public void close() {
    server.close();
  }
}
