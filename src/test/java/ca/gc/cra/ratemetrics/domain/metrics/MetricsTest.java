package ca.gc.cra.ratemetrics.domain.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsTest {
  private CollectorRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new CollectorRegistry();
  }

  @Test
  void counterStartsAtZeroAndAccumulates() {
    Counter counter = Counter.build().name("events_total").help("events").register(registry);

    assertEquals(0.0d, Metrics.getCounter(counter));
    assertTrue(Metrics.addCounter(counter, 3.0d));
    assertTrue(Metrics.addCounter(counter, 4.0d));
    assertEquals(7.0d, Metrics.getCounter(counter));

    Metrics.incCounter(counter);
    assertEquals(8.0d, Metrics.getCounter(counter));
  }

  @Test
  void addCounterRejectsNegativeAndNanDeltasWithoutChangingTheCounter() {
    Counter counter = Counter.build().name("events_total").help("events").register(registry);
    Metrics.addCounter(counter, 2.0d);

    assertFalse(Metrics.addCounter(counter, -1.0d));
    assertFalse(Metrics.addCounter(counter, Double.NaN));
    assertEquals(2.0d, Metrics.getCounter(counter));
  }

  @Test
  void gaugeOperationsReplaceAndAdjustValue() {
    Gauge gauge = Gauge.build().name("queue_depth").help("depth").register(registry);

    Metrics.setGauge(gauge, 10.0d);
    Metrics.incGauge(gauge);
    Metrics.addGauge(gauge, 4.0d);
    Metrics.subGauge(gauge, 2.5d);
    Metrics.decGauge(gauge);

    assertEquals(11.5d, Metrics.getGauge(gauge));
  }

  @Test
  void nameOfReportsFamilyName() {
    Gauge gauge = Gauge.build().name("queue_depth").help("depth").register(registry);

    assertEquals("queue_depth", Metrics.nameOf(gauge));
  }
}
