package ca.gc.cra.ratemetrics.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ratemetrics.config.MetricsServerConfig;
import ca.gc.cra.ratemetrics.domain.metrics.Metrics;
import ca.gc.cra.ratemetrics.testutil.LogCapture;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsServerTest {
  private static final MetricsServerConfig LOOPBACK_EPHEMERAL = new MetricsServerConfig("127.0.0.1", 0);

  @Test
  void servesRegistryInTextFormatAndLogsStartup() throws IOException, InterruptedException {
    MetricRegistry registry = new MetricRegistry();
    Counter requests = registry.registerCounter("requests", "Requests served");
    Gauge rate = registry.registerGauge("requests_rate", "Requests per second");
    Metrics.addCounter(requests, 3.0d);
    Metrics.setGauge(rate, 1.5d);

    try (LogCapture capture = LogCapture.of(MetricsServer.class);
        MetricsServer server = MetricsServer.start(LOOPBACK_EPHEMERAL, registry)) {
      assertEquals(
          List.of("Starting metrics server at http://localhost:" + server.port() + "/"), capture.messages());

      HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
      HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/metrics"))
          .timeout(Duration.ofSeconds(5))
          .GET()
          .build();
      HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

      assertEquals(200, response.statusCode());
      String body = response.body();
      assertTrue(body.contains("# HELP requests_total Requests served"), body);
      assertTrue(body.contains("requests_total 3.0"), body);
      assertTrue(body.contains("requests_rate 1.5"), body);
    }
  }

  @Test
  void bindFailureSurfacesAsUncheckedIoException() {
    MetricRegistry registry = new MetricRegistry();
    try (MetricsServer first = MetricsServer.start(LOOPBACK_EPHEMERAL, registry)) {
      MetricsServerConfig taken = new MetricsServerConfig("127.0.0.1", first.port());

      assertThrows(UncheckedIOException.class, () -> MetricsServer.start(taken, registry));
    }
  }
}
