package ca.gc.cra.ratemetrics.domain.metrics;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * A metric fed on every sampling tick, together with the function applied to the raw sample first.
 *
 * <p>Counters accumulate the transformed sample; gauges are replaced with the transformed sample divided by the
 * sampling interval. Callers dispatch on the two variants with {@code instanceof} patterns.</p>
 *
 * @since 0.1.0
 */
public sealed interface MetricTarget permits MetricTarget.CounterTarget, MetricTarget.GaugeTarget {

  /** Function applied to the raw sample; identity when none was supplied. */
  DoubleUnaryOperator update();

  default double transform(double sample) {
    return update().applyAsDouble(sample);
  }

  /**
   * Counter fed with additive deltas.
   *
   * @param counter registered counter handle
   * @param update sample transform; {@code null} means identity
   */
  record CounterTarget(Counter counter, DoubleUnaryOperator update) implements MetricTarget {
    public CounterTarget {
      Objects.requireNonNull(counter, "counter");
      update = update == null ? DoubleUnaryOperator.identity() : update;
    }
  }

  /**
   * Gauge overwritten with a per-second rate.
   *
   * @param gauge registered gauge handle
   * @param update sample transform; {@code null} means identity
   */
  record GaugeTarget(Gauge gauge, DoubleUnaryOperator update) implements MetricTarget {
    public GaugeTarget {
      Objects.requireNonNull(gauge, "gauge");
      update = update == null ? DoubleUnaryOperator.identity() : update;
    }
  }
}
