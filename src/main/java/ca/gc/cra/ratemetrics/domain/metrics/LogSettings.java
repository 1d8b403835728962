package ca.gc.cra.ratemetrics.domain.metrics;

import java.util.function.DoubleUnaryOperator;

/**
 * Whether a rate line is logged on each tick, and the transform applied to the sample before it is divided by the
 * interval.
 *
 * @param enabled {@code true} to emit the INFO rate line
 * @param update sample transform; {@code null} means identity
 * @since 0.1.0
 */
public record LogSettings(boolean enabled, DoubleUnaryOperator update) {
  private static final LogSettings ON = new LogSettings(true, null);
  private static final LogSettings OFF = new LogSettings(false, null);

  public LogSettings {
    update = update == null ? DoubleUnaryOperator.identity() : update;
  }

  /** Logging on, sample logged as is. */
  public static LogSettings on() {
    return ON;
  }

  public static LogSettings off() {
    return OFF;
  }

  /** Logging on, {@code update} applied to the sample before the rate is computed. */
  public static LogSettings on(DoubleUnaryOperator update) {
    return new LogSettings(true, update);
  }
}
