package ca.gc.cra.ratemetrics.application.rate;

import java.util.List;

/**
 * Raised under {@code CounterFailurePolicy.FAIL} when counters rejected the deltas of a tick.
 *
 * @since 0.1.0
 */
public final class CounterUpdateException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<String> rejected;

  CounterUpdateException(String tag, List<String> rejected) {
    super("Counters rejected rate deltas for " + tag + ": " + String.join(", ", rejected));
    this.rejected = List.copyOf(rejected);
  }

  /** Rejected counters as {@code name=delta} entries, in update order. */
  public List<String> rejected() {
    return rejected;
  }
}
