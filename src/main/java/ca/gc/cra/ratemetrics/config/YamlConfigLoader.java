package ca.gc.cra.ratemetrics.config;

import ca.gc.cra.ratemetrics.domain.metrics.CounterFailurePolicy;
import ca.gc.cra.ratemetrics.domain.metrics.LoggerDetails;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the metrics server address and rate logging sites from a YAML document.
 *
 * <pre>
 * server:
 *   port: 9090
 * loggers:
 *   ingest:
 *     label: pipeline
 *     unit: records
 *     action: processed
 *     intervalSecs: 5
 *     counters: [ingest_records_total]
 *     gauges: [ingest_records_rate]
 * </pre>
 *
 * <p>Missing logger fields take the values of {@link LoggerDetails#defaults()}, except {@code tag} which defaults
 * to the logger's key. Section and field names are matched case-insensitively.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads the document at {@code path}.
   *
   * @param path location of the YAML configuration
   * @return parsed configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static Optional<MetricsConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(new MetricsConfig(MetricsServerConfig.defaults(), Map.of()));
      }
      Map<String, Object> root = asMap(document, "root");

      MetricsServerConfig server = MetricsServerConfig.defaults();
      Object serverSection = findSection(root, "server");
      if (serverSection != null) {
        server = parseServer(asMap(serverSection, "server"));
      }

      Map<String, RateLoggerDefinition> loggers = new LinkedHashMap<>();
      Object loggersSection = findSection(root, "loggers");
      if (loggersSection != null) {
        for (Map.Entry<String, Object> entry : asMap(loggersSection, "loggers").entrySet()) {
          String name = entry.getKey().trim();
          if (name.isEmpty()) {
            throw new IllegalArgumentException("loggers section contains a blank key");
          }
          Map<String, Object> fields =
              entry.getValue() == null ? Map.of() : asMap(entry.getValue(), "loggers." + name);
          loggers.put(name, parseLogger(name, fields));
        }
      }

      return Optional.of(new MetricsConfig(server, loggers));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static MetricsServerConfig parseServer(Map<String, Object> section) {
    MetricsServerConfig defaults = MetricsServerConfig.defaults();
    String host = text(section, "host", defaults.host());
    String rawPort = text(section, "port", Integer.toString(defaults.port()));
    return new MetricsServerConfig(host, MetricsServerConfig.parsePort(rawPort));
  }

  private static RateLoggerDefinition parseLogger(String name, Map<String, Object> fields) {
    LoggerDetails defaults = LoggerDetails.defaults();
    String context = "loggers." + name;
    return new RateLoggerDefinition(
        name,
        text(fields, "label", defaults.label()),
        text(fields, "tag", name),
        text(fields, "unit", defaults.unit()),
        text(fields, "action", defaults.action()),
        number(fields, "intervalSecs", defaults.intervalSecs(), context),
        bool(fields, "log", defaults.log().enabled(), context),
        CounterFailurePolicy.from(text(fields, "counterFailurePolicy", "")),
        names(fields, "counters", context),
        names(fields, "gauges", context));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    String normalized = key.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(normalized)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static String text(Map<String, Object> fields, String key, String defaultValue) {
    Object value = findSection(fields, key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(key + " must be a scalar value");
    }
    return value.toString();
  }

  private static double number(Map<String, Object> fields, String key, double defaultValue, String context) {
    Object value = findSection(fields, key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(context + "." + key + " must be a number (was '" + value + "')", ex);
    }
  }

  private static boolean bool(Map<String, Object> fields, String key, boolean defaultValue, String context) {
    Object value = findSection(fields, key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(context + "." + key + " must be a boolean (was '" + value + "')");
    };
  }

  private static List<String> names(Map<String, Object> fields, String key, String context) {
    Object value = findSection(fields, key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof Iterable<?> items)) {
      throw new IllegalArgumentException(context + "." + key + " must be a list of metric names");
    }
    List<String> names = new ArrayList<>();
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException(context + "." + key + " entries must be metric names");
      }
      names.add(item.toString().trim());
    }
    return names;
  }
}
