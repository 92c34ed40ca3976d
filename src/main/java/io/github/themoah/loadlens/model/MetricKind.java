package io.github.themoah.loadlens.model;

import java.util.Locale;

/**
 * Coarse classification of a metric by its name. Selects the minimum effect
 * size a window needs to survive extraction.
 */
public enum MetricKind {
  LOAD,
  THROUGHPUT,
  ERROR_RATE,
  RESPONSE_TIME;

  public static MetricKind of(String metric) {
    String name = metric.toLowerCase(Locale.ROOT);
    if (name.contains("error")) {
      return ERROR_RATE;
    }
    if (name.contains("user")) {
      return LOAD;
    }
    if (name.contains("throughput") || name.contains("rps")) {
      return THROUGHPUT;
    }
    return RESPONSE_TIME;
  }
}
