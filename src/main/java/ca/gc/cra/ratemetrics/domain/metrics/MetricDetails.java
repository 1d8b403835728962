package ca.gc.cra.ratemetrics.domain.metrics;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Counters and gauges updated on each sampling tick, kept in insertion order.
 *
 * <p>Instances are configuration values: build them once per logging site and reuse them across ticks. They
 * deliberately keep identity equality.</p>
 *
 * @since 0.1.0
 */
public final class MetricDetails {
  private static final MetricDetails EMPTY = new MetricDetails(List.of(), List.of());

  private final List<MetricTarget.CounterTarget> counters;
  private final List<MetricTarget.GaugeTarget> gauges;

  private MetricDetails(List<MetricTarget.CounterTarget> counters, List<MetricTarget.GaugeTarget> gauges) {
    this.counters = List.copyOf(counters);
    this.gauges = List.copyOf(gauges);
  }

  /** Details that update no metric at all. */
  public static MetricDetails empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<MetricTarget.CounterTarget> counters() {
    return counters;
  }

  public List<MetricTarget.GaugeTarget> gauges() {
    return gauges;
  }

  /**
   * Returns all targets, counters first, each group in insertion order.
   *
   * @return immutable list of targets
   */
  public List<MetricTarget> targets() {
    List<MetricTarget> all = new ArrayList<>(counters.size() + gauges.size());
    all.addAll(counters);
    all.addAll(gauges);
    return List.copyOf(all);
  }

  public boolean isEmpty() {
    return counters.isEmpty() && gauges.isEmpty();
  }

  /** Accumulates targets; not thread-safe. */
  public static final class Builder {
    private final List<MetricTarget.CounterTarget> counters = new ArrayList<>();
    private final List<MetricTarget.GaugeTarget> gauges = new ArrayList<>();

    private Builder() {}

    public Builder counter(Counter counter) {
      return counter(counter, null);
    }

    public Builder counter(Counter counter, DoubleUnaryOperator update) {
      counters.add(new MetricTarget.CounterTarget(counter, update));
      return this;
    }

    public Builder gauge(Gauge gauge) {
      return gauge(gauge, null);
    }

    public Builder gauge(Gauge gauge, DoubleUnaryOperator update) {
      gauges.add(new MetricTarget.GaugeTarget(gauge, update));
      return this;
    }

    public MetricDetails build() {
      if (counters.isEmpty() && gauges.isEmpty()) {
        return EMPTY;
      }
      return new MetricDetails(counters, gauges);
    }
  }
}
