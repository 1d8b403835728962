package ca.gc.cra.ratemetrics.infrastructure.metrics;

import ca.gc.cra.ratemetrics.validation.Strings;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Description of a metric that has not been registered yet.
 *
 * <p>Nothing touches a registry until {@link MetricRegistry#register(Metric)} is called, so descriptors can be
 * declared as constants and registered at startup.</p>
 *
 * @param <S> handle type obtained on registration
 * @since 0.1.0
 */
public final class Metric<S> {
  private final String name;
  private final String help;
  private final List<String> labelNames;
  private final Function<CollectorRegistry, S> registrar;

  private Metric(String name, String help, List<String> labelNames, Function<CollectorRegistry, S> registrar) {
    this.name = name;
    this.help = help;
    this.labelNames = labelNames;
    this.registrar = registrar;
  }

  /**
   * Describes an unlabeled counter.
   *
   * @param name Prometheus metric name
   * @param help help text shown in the exposition format
   * @return counter descriptor
   */
  public static Metric<Counter> counter(String name, String help) {
    String validName = Strings.requireNonBlank("name", name);
    String validHelp = Strings.requireNonBlank("help", help);
    return new Metric<>(validName, validHelp, List.of(),
        registry -> Counter.build().name(validName).help(validHelp).register(registry));
  }

  /**
   * Describes an unlabeled gauge.
   *
   * @param name Prometheus metric name
   * @param help help text shown in the exposition format
   * @return gauge descriptor
   */
  public static Metric<Gauge> gauge(String name, String help) {
    String validName = Strings.requireNonBlank("name", name);
    String validHelp = Strings.requireNonBlank("help", help);
    return new Metric<>(validName, validHelp, List.of(),
        registry -> Gauge.build().name(validName).help(validHelp).register(registry));
  }

  /**
   * Describes a family of counters distinguished by label values.
   *
   * @param name Prometheus metric name
   * @param help help text shown in the exposition format
   * @param labelNames label names; at least one
   * @return counter vector descriptor
   */
  public static Metric<Vector<Counter.Child>> counterVector(String name, String help, String... labelNames) {
    String validName = Strings.requireNonBlank("name", name);
    String validHelp = Strings.requireNonBlank("help", help);
    List<String> labels = requireLabelNames(labelNames);
    return new Metric<>(validName, validHelp, labels,
        registry -> new Vector<>(
            Counter.build().name(validName).help(validHelp).labelNames(labels.toArray(new String[0]))
                .register(registry),
            labels));
  }

  /**
   * Describes a family of gauges distinguished by label values.
   *
   * @param name Prometheus metric name
   * @param help help text shown in the exposition format
   * @param labelNames label names; at least one
   * @return gauge vector descriptor
   */
  public static Metric<Vector<Gauge.Child>> gaugeVector(String name, String help, String... labelNames) {
    String validName = Strings.requireNonBlank("name", name);
    String validHelp = Strings.requireNonBlank("help", help);
    List<String> labels = requireLabelNames(labelNames);
    return new Metric<>(validName, validHelp, labels,
        registry -> new Vector<>(
            Gauge.build().name(validName).help(validHelp).labelNames(labels.toArray(new String[0]))
                .register(registry),
            labels));
  }

  public String name() {
    return name;
  }

  public String help() {
    return help;
  }

  /** Label names; empty for plain counters and gauges. */
  public List<String> labelNames() {
    return labelNames;
  }

  S registerWith(CollectorRegistry registry) {
    return registrar.apply(Objects.requireNonNull(registry, "registry"));
  }

  private static List<String> requireLabelNames(String... labelNames) {
    Objects.requireNonNull(labelNames, "labelNames");
    if (labelNames.length == 0) {
      throw new IllegalArgumentException("labelNames must not be empty");
    }
    List<String> labels = new ArrayList<>(labelNames.length);
    for (String labelName : labelNames) {
      labels.add(Strings.requireNonBlank("labelName", labelName));
    }
    return List.copyOf(labels);
  }
}
