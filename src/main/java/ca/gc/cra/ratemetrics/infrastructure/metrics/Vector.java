package ca.gc.cra.ratemetrics.infrastructure.metrics;

import io.prometheus.client.SimpleCollector;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Registered family of same-named metrics distinguished by label values.
 *
 * <p>Children are created on first use. The vector remembers which label values it created so they can be listed
 * with {@link #getVectorWith(Function)}; children created directly on the underlying collector are not tracked.</p>
 *
 * @param <C> child handle type ({@code Counter.Child} or {@code Gauge.Child})
 * @since 0.1.0
 */
public final class Vector<C> {
  private final SimpleCollector<C> collector;
  private final List<String> labelNames;
  private final ConcurrentMap<List<String>, C> children = new ConcurrentHashMap<>();

  Vector(SimpleCollector<C> collector, List<String> labelNames) {
    this.collector = Objects.requireNonNull(collector, "collector");
    this.labelNames = List.copyOf(labelNames);
  }

  public List<String> labelNames() {
    return labelNames;
  }

  /**
   * Runs {@code action} against the child for {@code labelValues}, creating it when absent.
   *
   * @param labelValues one value per label name, in declaration order
   * @param action operation applied to the child
   * @throws IllegalArgumentException if the number of values does not match the label names
   */
  public void withLabel(List<String> labelValues, Consumer<? super C> action) {
    Objects.requireNonNull(action, "action");
    List<String> key = requireLabelValues(labelValues);
    C child = children.computeIfAbsent(key, values -> collector.labels(values.toArray(new String[0])));
    action.accept(child);
  }

  /**
   * Drops the child for {@code labelValues}; a later {@link #withLabel} starts it from zero.
   *
   * @param labelValues one value per label name
   */
  public void removeLabel(List<String> labelValues) {
    List<String> key = requireLabelValues(labelValues);
    collector.remove(key.toArray(new String[0]));
    children.remove(key);
  }

  /** Drops every child. */
  public void clearLabels() {
    collector.clear();
    children.clear();
  }

  /**
   * Reads every tracked child.
   *
   * @param reader projection applied to each child, e.g. {@code Counter.Child::get}
   * @param <A> projected type
   * @return label values paired with the projection, in no particular order
   */
  public <A> List<Map.Entry<List<String>, A>> getVectorWith(Function<? super C, ? extends A> reader) {
    Objects.requireNonNull(reader, "reader");
    List<Map.Entry<List<String>, A>> result = new ArrayList<>(children.size());
    for (Map.Entry<List<String>, C> entry : children.entrySet()) {
      result.add(Map.entry(entry.getKey(), reader.apply(entry.getValue())));
    }
    return result;
  }

  private List<String> requireLabelValues(List<String> labelValues) {
    Objects.requireNonNull(labelValues, "labelValues");
    if (labelValues.size() != labelNames.size()) {
      throw new IllegalArgumentException(
          "expected " + labelNames.size() + " label values for " + labelNames + " (was " + labelValues.size() + ")");
    }
    return List.copyOf(labelValues);
  }
}
