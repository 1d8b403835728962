package ca.gc.cra.ratemetrics.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registers metric descriptors with a Prometheus {@link CollectorRegistry}.
 * <p><strong>Role:</strong> Startup-time adapter; handles it returns live as long as the registry.</p>
 * <p><strong>Errors:</strong> Registering a name twice propagates the client's {@link IllegalArgumentException};
 * callers treat it as a fatal startup error.</p>
 * <p><strong>Thread-safety:</strong> Delegates to the thread-safe {@link CollectorRegistry}.</p>
 *
 * @since 0.1.0
 */
public final class MetricRegistry {
  private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);
  private static final MetricRegistry DEFAULT = new MetricRegistry(CollectorRegistry.defaultRegistry);

  private final CollectorRegistry registry;

  /** Creates a registry backed by a fresh, private {@link CollectorRegistry}. */
  public MetricRegistry() {
    this(new CollectorRegistry());
  }

  public MetricRegistry(CollectorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Returns the registry backed by {@link CollectorRegistry#defaultRegistry}. */
  public static MetricRegistry defaultRegistry() {
    return DEFAULT;
  }

  /**
   * Registers {@code metric} and returns its handle.
   *
   * @param metric descriptor to register
   * @param <S> handle type
   * @return registered handle
   * @throws IllegalArgumentException if a metric with the same name is already registered
   */
  public <S> S register(Metric<S> metric) {
    Objects.requireNonNull(metric, "metric");
    S handle = metric.registerWith(registry);
    log.debug("Registered metric {} labels={}", metric.name(), metric.labelNames());
    return handle;
  }

  public Counter registerCounter(String name, String help) {
    return register(Metric.counter(name, help));
  }

  public Gauge registerGauge(String name, String help) {
    return register(Metric.gauge(name, help));
  }

  public Vector<Counter.Child> registerCounterVector(String name, String help, String... labelNames) {
    return register(Metric.counterVector(name, help, labelNames));
  }

  public Vector<Gauge.Child> registerGaugeVector(String name, String help, String... labelNames) {
    return register(Metric.gaugeVector(name, help, labelNames));
  }

  /** Underlying Prometheus registry, as served by {@link MetricsServer}. */
  public CollectorRegistry collectorRegistry() {
    return registry;
  }
}
