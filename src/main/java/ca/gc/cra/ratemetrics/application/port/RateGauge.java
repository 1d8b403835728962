package ca.gc.cra.ratemetrics.application.port;

import java.util.stream.Stream;

/**
 * <strong>What:</strong> Port wrapping a stream so its throughput is sampled and reported on a timer.
 * <p><strong>Why:</strong> Decouples pipelines from the timer machinery that turns element counts into rates.</p>
 * <p><strong>Contract:</strong> The returned stream passes every element through unchanged and in order, but it
 * does not end when {@code source} ends: the timer keeps reporting until the stream is closed. Use
 * {@code StreamTaps.finiteWithRateGauge} when the consumer needs a stream that ends with its source.</p>
 *
 * @param <K> tag type identifying the logging site
 * @since 0.1.0
 */
public interface RateGauge<K> {
  /**
   * Wraps {@code source} with rate sampling for {@code tag}.
   *
   * @param tag logging site whose details drive the sampling interval
   * @param source elements to observe
   * @param <T> element type
   * @return stream of the same elements that only ends once closed
   * @throws IllegalArgumentException if {@code tag} is not configured
   */
  <T> Stream<T> withRateGauge(K tag, Stream<T> source);
}
