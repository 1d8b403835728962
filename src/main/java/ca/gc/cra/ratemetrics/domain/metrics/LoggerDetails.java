package ca.gc.cra.ratemetrics.domain.metrics;

import ca.gc.cra.ratemetrics.validation.Numbers;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of one rate logging site.
 * <p><strong>Why:</strong> Bundles the wording of the rate line, the sampling interval used as the rate denominator,
 * and the counters/gauges fed on every tick so a site is configured once and reused across ticks.</p>
 * <p><strong>Role:</strong> Configuration value consumed by {@code RateLogger} implementations and rate gauges.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject intervals that would turn rates into infinity or NaN.</li>
 *   <li>Carry the counter failure policy applied when a counter rejects a delta.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between pipeline threads.</p>
 * <p><strong>Equality:</strong> Identity only. Instances are never used as map keys or sorted.</p>
 *
 * @since 0.1.0
 */
public final class LoggerDetails {
  private static final LoggerDetails DEFAULTS = new Builder().build();

  private final String label;
  private final String tag;
  private final String unit;
  private final String action;
  private final double intervalSecs;
  private final LogSettings log;
  private final MetricDetails metrics;
  private final CounterFailurePolicy counterFailurePolicy;

  private LoggerDetails(Builder builder) {
    this.label = Objects.requireNonNull(builder.label, "label");
    this.tag = Objects.requireNonNull(builder.tag, "tag");
    this.unit = Objects.requireNonNull(builder.unit, "unit");
    this.action = Objects.requireNonNull(builder.action, "action");
    this.intervalSecs = Numbers.requirePositiveFinite("intervalSecs", builder.intervalSecs);
    this.log = Objects.requireNonNull(builder.log, "log");
    this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
    this.counterFailurePolicy = Objects.requireNonNull(builder.counterFailurePolicy, "counterFailurePolicy");
  }

  /**
   * Returns the defaults: {@code defaultLabel}, {@code defaultTag}, {@code defaultUnit}, {@code defaultAction},
   * one second, logging enabled, no metrics, {@link CounterFailurePolicy#WARN}.
   *
   * @return shared default details
   */
  public static LoggerDetails defaults() {
    return DEFAULTS;
  }

  /**
   * Starts a builder seeded with {@link #defaults()}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a builder seeded with this instance's values.
   *
   * @return new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .label(label)
        .tag(tag)
        .unit(unit)
        .action(action)
        .intervalSecs(intervalSecs)
        .log(log)
        .metrics(metrics)
        .counterFailurePolicy(counterFailurePolicy);
  }

  /** Name of the SLF4J logger receiving the rate line. */
  public String label() {
    return label;
  }

  public String tag() {
    return tag;
  }

  public String unit() {
    return unit;
  }

  public String action() {
    return action;
  }

  /** Sampling interval in seconds; always finite and positive. */
  public double intervalSecs() {
    return intervalSecs;
  }

  public LogSettings log() {
    return log;
  }

  public MetricDetails metrics() {
    return metrics;
  }

  public CounterFailurePolicy counterFailurePolicy() {
    return counterFailurePolicy;
  }

  @Override
  public String toString() {
    return "LoggerDetails[label=" + label + ", tag=" + tag + ", unit=" + unit + ", action=" + action
        + ", intervalSecs=" + intervalSecs + ", log=" + log.enabled()
        + ", counters=" + metrics.counters().size() + ", gauges=" + metrics.gauges().size() + "]";
  }

  /** Mutable builder; validation happens in {@link #build()}. */
  public static final class Builder {
    private String label = "defaultLabel";
    private String tag = "defaultTag";
    private String unit = "defaultUnit";
    private String action = "defaultAction";
    private double intervalSecs = 1.0d;
    private LogSettings log = LogSettings.on();
    private MetricDetails metrics = MetricDetails.empty();
    private CounterFailurePolicy counterFailurePolicy = CounterFailurePolicy.WARN;

    private Builder() {}

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder tag(String tag) {
      this.tag = tag;
      return this;
    }

    public Builder unit(String unit) {
      this.unit = unit;
      return this;
    }

    public Builder action(String action) {
      this.action = action;
      return this;
    }

    public Builder intervalSecs(double intervalSecs) {
      this.intervalSecs = intervalSecs;
      return this;
    }

    public Builder log(LogSettings log) {
      this.log = log;
      return this;
    }

    public Builder metrics(MetricDetails metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder counterFailurePolicy(CounterFailurePolicy counterFailurePolicy) {
      this.counterFailurePolicy = counterFailurePolicy;
      return this;
    }

    /**
     * Builds the details.
     *
     * @return immutable details
     * @throws NullPointerException if a text field, the log settings, the metrics, or the policy is {@code null}
     * @throws IllegalArgumentException if {@code intervalSecs} is not a finite positive number
     */
    public LoggerDetails build() {
      return new LoggerDetails(this);
    }
  }
}
