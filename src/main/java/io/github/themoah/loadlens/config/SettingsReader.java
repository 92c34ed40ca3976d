package io.github.themoah.loadlens.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads typed values out of a project settings dictionary.
 *
 * <p>Absent keys resolve silently to the default. Unparsable or out-of-range
 * values are logged and also resolve to the default, so a bad setting never
 * fails an analysis run.
 */
final class SettingsReader {

  private static final Logger log = LoggerFactory.getLogger(SettingsReader.class);

  private final Map<String, ?> values;
  private final Set<String> consumed = new HashSet<>();

  SettingsReader(Map<String, ?> values) {
    this.values = values == null ? Map.of() : values;
  }

  boolean readBoolean(String key, boolean defaultValue) {
    Object value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    if (text.equals("true") || text.equals("false")) {
      return Boolean.parseBoolean(text);
    }
    log.warn("Invalid boolean for {}: '{}', using default: {}", key, value, defaultValue);
    return defaultValue;
  }

  double readDouble(String key, double defaultValue, double min, double max) {
    Object value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    double parsed;
    if (value instanceof Number n) {
      parsed = n.doubleValue();
    } else {
      try {
        parsed = Double.parseDouble(value.toString().trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid number for {}: '{}', using default: {}", key, value, defaultValue);
        return defaultValue;
      }
    }
    if (Double.isNaN(parsed) || parsed < min || parsed > max) {
      log.warn("Value for {} out of range [{}, {}]: {}, using default: {}", key, min, max, parsed, defaultValue);
      return defaultValue;
    }
    return parsed;
  }

  int readInt(String key, int defaultValue, int min, int max) {
    Object value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    long parsed;
    if (value instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        log.warn("Invalid integer for {}: '{}', using default: {}", key, value, defaultValue);
        return defaultValue;
      }
      parsed = n.longValue();
    } else {
      try {
        parsed = Long.parseLong(value.toString().trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: '{}', using default: {}", key, value, defaultValue);
        return defaultValue;
      }
    }
    if (parsed < min || parsed > max) {
      log.warn("Value for {} out of range [{}, {}]: {}, using default: {}", key, min, max, parsed, defaultValue);
      return defaultValue;
    }
    return (int) parsed;
  }

  long readLong(String key, long defaultValue) {
    Object value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      return n.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: '{}', using default: {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  String readString(String key, String defaultValue) {
    Object value = lookup(key);
    if (value == null || value.toString().isBlank()) {
      return defaultValue;
    }
    return value.toString().trim();
  }

  /**
   * Reads a list given either as a collection or as a comma-separated string.
   */
  List<String> readList(String key, List<String> defaultValue) {
    Object value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    List<String> items = new ArrayList<>();
    if (value instanceof Collection<?> collection) {
      for (Object item : collection) {
        if (item != null && !item.toString().isBlank()) {
          items.add(item.toString().trim());
        }
      }
    } else {
      for (String item : value.toString().split(",")) {
        if (!item.isBlank()) {
          items.add(item.trim());
        }
      }
    }
    if (items.isEmpty()) {
      log.warn("Empty list for {}, using default: {}", key, defaultValue);
      return defaultValue;
    }
    return List.copyOf(items);
  }

  /**
   * Logs keys that no settings record consumed.
   */
  void warnUnknownKeys() {
    Set<String> unknown = new TreeSet<>(values.keySet());
    unknown.removeAll(consumed);
    if (!unknown.isEmpty()) {
      log.warn("Ignoring unknown analysis settings: {}", unknown);
    }
  }

  private Object lookup(String key) {
    consumed.add(key);
    return values.get(key);
  }
}
