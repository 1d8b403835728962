package ca.gc.cra.ratemetrics.domain.metrics;

import java.util.Locale;

/**
 * What a rate logger does once a counter rejected a tick's delta (negative or NaN after the update function).
 *
 * <p>Every other counter, gauge, and the log line are still processed before the policy applies.</p>
 *
 * @since 0.1.0
 */
public enum CounterFailurePolicy {
  /** Drop the rejection silently. */
  IGNORE,
  /** Log one WARN line per rejected counter. */
  WARN,
  /** Throw once all entries of the tick were processed. */
  FAIL;

  /**
   * Parses a policy name case-insensitively.
   *
   * @param raw policy name such as {@code "warn"}; blank selects {@link #WARN}
   * @return parsed policy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static CounterFailurePolicy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return WARN;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ignore" -> IGNORE;
      case "warn" -> WARN;
      case "fail" -> FAIL;
      default -> throw new IllegalArgumentException(
          "counterFailurePolicy must be 'ignore', 'warn' or 'fail' (was '" + raw + "')");
    };
  }
}
