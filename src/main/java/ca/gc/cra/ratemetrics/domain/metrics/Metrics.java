package ca.gc.cra.ratemetrics.domain.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.List;
import java.util.Objects;

/**
 * Read and mutate operations on registered counter and gauge handles.
 *
 * <p>Handles stay owned by the Prometheus registry they were registered with; these helpers only forward to
 * the client library and are safe to call concurrently from any pipeline stage.</p>
 *
 * @since 0.1.0
 */
public final class Metrics {
  private static final String UNNAMED = "<unnamed>";

  private Metrics() {}

  public static double getCounter(Counter counter) {
    return Objects.requireNonNull(counter, "counter").get();
  }

  public static void incCounter(Counter counter) {
    Objects.requireNonNull(counter, "counter").inc();
  }

  /**
   * Adds {@code delta} to a counter.
   *
   * @param counter registered counter
   * @param delta amount to add
   * @return {@code false} without touching the counter when {@code delta} is negative or NaN, {@code true}
   *     otherwise
   */
  public static boolean addCounter(Counter counter, double delta) {
    Objects.requireNonNull(counter, "counter");
    if (!(delta >= 0.0d)) {
      return false;
    }
    counter.inc(delta);
    return true;
  }

  public static double getGauge(Gauge gauge) {
    return Objects.requireNonNull(gauge, "gauge").get();
  }

  public static void incGauge(Gauge gauge) {
    Objects.requireNonNull(gauge, "gauge").inc();
  }

  public static void addGauge(Gauge gauge, double delta) {
    Objects.requireNonNull(gauge, "gauge").inc(delta);
  }

  public static void setGauge(Gauge gauge, double value) {
    Objects.requireNonNull(gauge, "gauge").set(value);
  }

  public static void subGauge(Gauge gauge, double delta) {
    Objects.requireNonNull(gauge, "gauge").dec(delta);
  }

  public static void decGauge(Gauge gauge) {
    Objects.requireNonNull(gauge, "gauge").dec();
  }

  /**
   * Returns the family name a collector exposes, for diagnostics.
   *
   * @param collector counter, gauge, or any other collector
   * @return first metric family name, or {@code "<unnamed>"} when the collector exposes none
   */
  public static String nameOf(Collector collector) {
    List<Collector.MetricFamilySamples> families = Objects.requireNonNull(collector, "collector").collect();
    return families.isEmpty() ? UNNAMED : families.get(0).name;
  }
}
