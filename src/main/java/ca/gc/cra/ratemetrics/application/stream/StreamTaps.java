package ca.gc.cra.ratemetrics.application.stream;

import ca.gc.cra.ratemetrics.application.port.RateGauge;
import ca.gc.cra.ratemetrics.application.rate.RateLoggerConfig;
import ca.gc.cra.ratemetrics.validation.Numbers;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <strong>What:</strong> Stream combinators that observe a pipeline without changing its elements.
 * <p><strong>Role:</strong> Plug-ins for {@link Stream} pipelines: a periodic tap and a finite wrapper around
 * {@link RateGauge}.</p>
 * <p><strong>Ordering:</strong> Output order always equals input order; side effects for an element run before that
 * element is handed downstream.</p>
 * <p><strong>Thread-safety:</strong> Returned streams are sequential and must be consumed by one thread at a time.</p>
 *
 * @since 0.1.0
 */
public final class StreamTaps {
  private StreamTaps() {
    // Utility
  }

  /**
   * Runs {@code action} on every {@code interval}-th element and passes all elements through unchanged.
   *
   * <p>The action sees elements number {@code interval}, {@code 2 * interval}, ... counted from one, so a source of
   * {@code L} elements triggers it {@code L / interval} times. Exceptions thrown by the action propagate to the
   * consumer of the returned stream. Closing the returned stream closes {@code source}.</p>
   *
   * @param interval number of elements between two actions; must be positive
   * @param action side effect receiving the triggering element
   * @param source elements to observe
   * @param <T> element type
   * @return lazily evaluated stream of the same elements
   * @throws IllegalArgumentException if {@code interval <= 0}
   */
  public static <T> Stream<T> doAt(int interval, Consumer<? super T> action, Stream<T> source) {
    Numbers.requirePositive("interval", interval);
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(source, "source");
    Spliterator<T> tapped = new TapSpliterator<>(source.spliterator(), interval, action);
    return StreamSupport.stream(tapped, false).onClose(source::close);
  }

  /**
   * Reports {@code interval} events to the rate logger configured for {@code tag} every {@code interval} elements.
   *
   * @param interval elements per report; must be positive
   * @param config logging sites and the logger reporting them
   * @param tag site to report under; must be configured
   * @param source elements to count
   * @param <K> tag type
   * @param <T> element type
   * @return lazily evaluated stream of the same elements
   * @throws IllegalArgumentException if {@code interval <= 0} or {@code tag} is not configured
   */
  public static <K, T> Stream<T> rateLogEvery(
      int interval, RateLoggerConfig<K> config, K tag, Stream<T> source) {
    Objects.requireNonNull(config, "config");
    // unknown tags fail here rather than on the first report
    config.detailsFor(tag);
    return doAt(interval, element -> config.report(tag, interval), source);
  }

  /**
   * Wraps {@code source} with {@code gauge} but ends when {@code source} ends.
   *
   * <p>Elements are wrapped in {@link Optional}, followed by one empty marker, fed through the gauge, and unwrapped
   * again up to the marker. A finite source yields the same elements in the same order and then ends; an infinite
   * source yields an infinite stream. Reaching the marker closes the gauged stream, which stops the gauge, so a
   * drained stream reports nothing further even when the caller never closes it. Closing the returned stream
   * early stops the gauge as well.</p>
   *
   * @param gauge rate gauge whose own output never ends
   * @param tag logging site the gauge reports under
   * @param source elements to observe; must not contain {@code null}
   * @param <K> tag type
   * @param <T> element type
   * @return stream of the same elements ending with {@code source}
   */
  public static <K, T> Stream<T> finiteWithRateGauge(RateGauge<K> gauge, K tag, Stream<T> source) {
    Objects.requireNonNull(gauge, "gauge");
    Objects.requireNonNull(source, "source");
    Stream<Optional<T>> marked = Stream.concat(source.map(Optional::of), Stream.of(Optional.<T>empty()));
    Stream<Optional<T>> gauged = gauge.withRateGauge(tag, marked);
    Spliterator<T> untilMarker = new UntilMarkerSpliterator<>(gauged.spliterator(), gauged::close);
    return StreamSupport.stream(untilMarker, false).onClose(gauged::close);
  }

  private static final class UntilMarkerSpliterator<T> implements Spliterator<T> {
    private final Spliterator<Optional<T>> upstream;
    private final Runnable onEnd;
    private Optional<T> current;
    private boolean ended;

    private UntilMarkerSpliterator(Spliterator<Optional<T>> upstream, Runnable onEnd) {
      this.upstream = upstream;
      this.onEnd = onEnd;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
      if (ended) {
        return false;
      }
      if (!upstream.tryAdvance(element -> current = element) || current.isEmpty()) {
        end();
        return false;
      }
      T element = current.get();
      current = null;
      action.accept(element);
      return true;
    }

    private void end() {
      ended = true;
      current = null;
      onEnd.run();
    }

    @Override
    public Spliterator<T> trySplit() {
      return null;
    }

    @Override
    public long estimateSize() {
      return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
      return ORDERED | NONNULL;
    }
  }

  private static final class TapSpliterator<T> implements Spliterator<T> {
    private final Spliterator<T> upstream;
    private final int interval;
    private final Consumer<? super T> action;
    private int remaining;

    private TapSpliterator(Spliterator<T> upstream, int interval, Consumer<? super T> action) {
      this.upstream = upstream;
      this.interval = interval;
      this.action = action;
      this.remaining = interval;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> downstream) {
      return upstream.tryAdvance(element -> {
        if (--remaining == 0) {
          remaining = interval;
          action.accept(element);
        }
        downstream.accept(element);
      });
    }

    @Override
    public Spliterator<T> trySplit() {
      return null;
    }

    @Override
    public long estimateSize() {
      return upstream.estimateSize();
    }

    // never SIZED: count() would skip traversal and with it the action
    @Override
    public int characteristics() {
      return upstream.characteristics() & (ORDERED | NONNULL);
    }
  }
}
