package ca.gc.cra.ratemetrics.application.rate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ratemetrics.domain.metrics.CounterFailurePolicy;
import ca.gc.cra.ratemetrics.domain.metrics.LogSettings;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import ca.gc.cra.ratemetrics.domain.metrics.MetricDetails;
import ca.gc.cra.ratemetrics.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InfoRateLoggerTest {
  private static final String LABEL = "rate.test";

  private CollectorRegistry registry;
  private InfoRateLogger<String> logger;

  @BeforeEach
  void setUp() {
    registry = new CollectorRegistry();
    logger = new InfoRateLogger<>();
  }

  @Test
  void countersReceiveSampleAndGaugesReceiveRate() {
    Counter counter = Counter.build().name("events_total").help("events").register(registry);
    Gauge gauge = Gauge.build().name("events_rate").help("rate").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .intervalSecs(2.0d)
        .log(LogSettings.off())
        .metrics(MetricDetails.builder().counter(counter).gauge(gauge).build())
        .build();

    logger.log(details, "ingest", 10);

    assertEquals(10.0d, counter.get());
    assertEquals(5.0d, gauge.get());

    logger.log(details, "ingest", 4);

    assertEquals(14.0d, counter.get());
    assertEquals(2.0d, gauge.get());
  }

  @Test
  void updateFunctionsApplyPerEntry() {
    Counter bytes = Counter.build().name("bytes_total").help("bytes").register(registry);
    Gauge kilobytes = Gauge.build().name("kilobytes_rate").help("rate").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .intervalSecs(4.0d)
        .log(LogSettings.off())
        .metrics(MetricDetails.builder()
            .counter(bytes, value -> value * 1024)
            .gauge(kilobytes, value -> value / 2)
            .build())
        .build();

    logger.log(details, "ingest", 8);

    assertEquals(8192.0d, bytes.get());
    assertEquals(1.0d, kilobytes.get());
  }

  @Test
  void logsRateLineOnLabelLogger() {
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .tag("ingest")
        .action("processed")
        .unit("records")
        .intervalSecs(4.0d)
        .log(LogSettings.on(value -> value * 2))
        .build();

    List<ILoggingEvent> events;
    try (LogCapture capture = LogCapture.of(LABEL)) {
      logger.log(details, "ignored", 8);
      events = capture.events();
    }

    assertEquals(1, events.size());
    assertEquals(Level.INFO, events.get(0).getLevel());
    assertEquals("ingest processed at the rate of 4.0 records/sec", events.get(0).getFormattedMessage());
  }

  @Test
  void disabledLoggingStaysQuiet() {
    LoggerDetails details = LoggerDetails.builder().label(LABEL).log(LogSettings.off()).build();

    try (LogCapture capture = LogCapture.of(LABEL)) {
      logger.log(details, "ingest", 3);
      assertTrue(capture.events().isEmpty());
    }
  }

  @Test
  void rejectedCounterDoesNotStopOtherUpdatesAndWarnsByDefault() {
    Counter negative = Counter.build().name("negative").help("negative").register(registry);
    Counter healthy = Counter.build().name("healthy_total").help("healthy").register(registry);
    Gauge gauge = Gauge.build().name("healthy_rate").help("rate").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .tag("ingest")
        .log(LogSettings.off())
        .metrics(MetricDetails.builder()
            .counter(negative, value -> -value)
            .counter(healthy)
            .gauge(gauge)
            .build())
        .build();

    List<String> warnings;
    try (LogCapture capture = LogCapture.of(InfoRateLogger.class)) {
      logger.log(details, "ingest", 6);
      warnings = capture.messages();
    }

    assertEquals(0.0d, negative.get());
    assertEquals(6.0d, healthy.get());
    assertEquals(6.0d, gauge.get());
    assertEquals(List.of("Counter rejected rate delta for ingest: negative=-6.0"), warnings);
  }

  @Test
  void failPolicyThrowsAfterProcessingEveryEntry() {
    Counter negative = Counter.build().name("negative").help("negative").register(registry);
    Gauge gauge = Gauge.build().name("rate").help("rate").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .tag("ingest")
        .counterFailurePolicy(CounterFailurePolicy.FAIL)
        .metrics(MetricDetails.builder().counter(negative, value -> -value).gauge(gauge).build())
        .build();

    CounterUpdateException ex;
    List<String> lines;
    try (LogCapture capture = LogCapture.of(LABEL)) {
      ex = assertThrows(CounterUpdateException.class, () -> logger.log(details, "ingest", 3));
      lines = capture.messages();
    }

    assertEquals(List.of("negative=-3.0"), ex.rejected());
    assertEquals(3.0d, gauge.get());
    assertEquals(1, lines.size());
  }

  @Test
  void ignorePolicyStaysQuiet() {
    Counter negative = Counter.build().name("negative").help("negative").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .log(LogSettings.off())
        .counterFailurePolicy(CounterFailurePolicy.IGNORE)
        .metrics(MetricDetails.builder().counter(negative, value -> -value).build())
        .build();

    try (LogCapture capture = LogCapture.of(InfoRateLogger.class)) {
      logger.log(details, "ingest", 3);
      assertTrue(capture.events().isEmpty());
    }
  }

  @Test
  void failingUpdateDoesNotSkipLaterEntriesOrTheRateLine() {
    Gauge bad = Gauge.build().name("bad_rate").help("bad").register(registry);
    Gauge good = Gauge.build().name("good_rate").help("good").register(registry);
    Counter total = Counter.build().name("processed").help("processed").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .tag("ingest")
        .metrics(MetricDetails.builder()
            .gauge(bad, value -> {
              throw new IllegalStateException("fn");
            })
            .gauge(good)
            .counter(total)
            .build())
        .build();

    IllegalStateException ex;
    List<String> lines;
    try (LogCapture capture = LogCapture.of(LABEL)) {
      ex = assertThrows(IllegalStateException.class, () -> logger.log(details, "ingest", 10));
      lines = capture.messages();
    }

    assertEquals("fn", ex.getMessage());
    assertEquals(10.0d, good.get());
    assertEquals(10.0d, total.get());
    assertEquals(0.0d, bad.get());
    assertEquals(1, lines.size());
  }

  @Test
  void laterFailuresAreSuppressedIntoTheFirst() {
    Gauge first = Gauge.build().name("first_rate").help("first").register(registry);
    Gauge second = Gauge.build().name("second_rate").help("second").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .log(LogSettings.off())
        .metrics(MetricDetails.builder()
            .gauge(first, value -> {
              throw new IllegalStateException("first");
            })
            .gauge(second, value -> {
              throw new IllegalArgumentException("second");
            })
            .build())
        .build();

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> logger.log(details, "ingest", 1));

    assertEquals(1, ex.getSuppressed().length);
    assertEquals("second", ex.getSuppressed()[0].getMessage());
  }

  @Test
  void failPolicyCarriesUpdateFailuresAsSuppressed() {
    Counter negative = Counter.build().name("negative").help("negative").register(registry);
    Gauge broken = Gauge.build().name("broken_rate").help("broken").register(registry);
    LoggerDetails details = LoggerDetails.builder()
        .label(LABEL)
        .tag("ingest")
        .log(LogSettings.off())
        .counterFailurePolicy(CounterFailurePolicy.FAIL)
        .metrics(MetricDetails.builder()
            .counter(negative, value -> -value)
            .gauge(broken, value -> {
              throw new IllegalStateException("fn");
            })
            .build())
        .build();

    CounterUpdateException ex = assertThrows(CounterUpdateException.class, () -> logger.log(details, "ingest", 2));

    assertEquals(List.of("negative=-2.0"), ex.rejected());
    assertEquals(1, ex.getSuppressed().length);
    assertEquals("fn", ex.getSuppressed()[0].getMessage());
  }

  @Test
  void negativeSampleIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> logger.log(LoggerDetails.defaults(), "ingest", -1));
  }
}
