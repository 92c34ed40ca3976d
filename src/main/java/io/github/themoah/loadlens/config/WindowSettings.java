package io.github.themoah.loadlens.config;

import io.github.themoah.loadlens.model.MetricKind;

/**
 * Settings for window extraction and merging.
 *
 * @param mergeGapSamples consecutive normal samples bridged inside one window
 * @param baselineWindow samples before a window used for its baseline median
 * @param minDeltaPctResponseTime effect-size floor for response-time-like metrics
 * @param minDeltaPctErrorRate effect-size floor for error-rate-like metrics
 * @param minDeltaPctThroughput effect-size floor for throughput and load metrics
 */
public record WindowSettings(
  int mergeGapSamples,
  int baselineWindow,
  double minDeltaPctResponseTime,
  double minDeltaPctErrorRate,
  double minDeltaPctThroughput
) {

  public static WindowSettings defaults() {
    return read(new SettingsReader(null));
  }

  /**
   * Minimum absolute {@code delta_pct} a window of the given kind needs to survive.
   */
  public double minDeltaPct(MetricKind kind) {
    return switch (kind) {
      case ERROR_RATE -> minDeltaPctErrorRate;
      case THROUGHPUT, LOAD -> minDeltaPctThroughput;
      case RESPONSE_TIME -> minDeltaPctResponseTime;
    };
  }

  static WindowSettings read(SettingsReader reader) {
    return new WindowSettings(
      reader.readInt("merge_gap_samples", 4, 0, 20),
      reader.readInt("baseline_window", 5, 1, 50),
      reader.readDouble("min_delta_pct_response_time", 10.0, 0.0, 1000.0),
      reader.readDouble("min_delta_pct_error_rate", 20.0, 0.0, 1000.0),
      reader.readDouble("min_delta_pct_throughput", 10.0, 0.0, 1000.0)
    );
  }
}
