package ca.gc.cra.ratemetrics.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by rate logger and metrics server configuration.
 * <p><strong>Why:</strong> Guards against sampling intervals, tap intervals, and ports that would divide by zero,
 * never fire, or fail to bind once the registry and HTTP server are running.
 * <p><strong>Role:</strong> Support utilities invoked by configuration builders and stream combinators.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared in configuration documents.</li>
 *   <li>Reject non-positive and non-finite rate denominators.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., seconds, port number)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that an integer is strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value <= 0}
   */
  public static int requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and strictly positive, making it safe to divide by.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, zero, or negative
   */
  public static double requirePositiveFinite(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0d) {
      throw new IllegalArgumentException(
          label(name) + " must be a finite positive number (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
