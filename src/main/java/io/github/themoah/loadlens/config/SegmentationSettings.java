package io.github.themoah.loadlens.config;

import io.github.themoah.loadlens.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for ramp-up / fixed-load segmentation.
 *
 * @param rollingWindow samples in the rolling correlation window
 * @param correlationThreshold correlation below which a sample is a breach
 * @param requiredBreachesMin lower bound on consecutive breaches for a tipping point
 * @param requiredBreachesMax upper bound on consecutive breaches for a tipping point
 * @param requiredBreachesFraction fraction of samples used to size the required breaches
 * @param baseMetric load metric correlated against throughput
 * @param loadStabilityCv rolling CV at or below which the base metric counts as stable
 * @param fixedLoadPercentage percentage of stable samples needed for a fixed-load test
 */
public record SegmentationSettings(
  int rollingWindow,
  double correlationThreshold,
  int requiredBreachesMin,
  int requiredBreachesMax,
  double requiredBreachesFraction,
  String baseMetric,
  double loadStabilityCv,
  double fixedLoadPercentage
) {

  private static final Logger log = LoggerFactory.getLogger(SegmentationSettings.class);

  static final int DEFAULT_ROLLING_WINDOW = 5;
  static final double DEFAULT_CORRELATION_THRESHOLD = 0.4;
  static final int DEFAULT_BREACHES_MIN = 3;
  static final int DEFAULT_BREACHES_MAX = 5;
  static final double DEFAULT_BREACHES_FRACTION = 0.15;
  static final double DEFAULT_LOAD_STABILITY_CV = 0.05;
  static final double DEFAULT_FIXED_LOAD_PERCENTAGE = 60.0;

  public static SegmentationSettings defaults() {
    return new SegmentationSettings(DEFAULT_ROLLING_WINDOW, DEFAULT_CORRELATION_THRESHOLD,
      DEFAULT_BREACHES_MIN, DEFAULT_BREACHES_MAX, DEFAULT_BREACHES_FRACTION, MetricNames.USERS,
      DEFAULT_LOAD_STABILITY_CV, DEFAULT_FIXED_LOAD_PERCENTAGE);
  }

  static SegmentationSettings read(SettingsReader reader) {
    int breachesMin = reader.readInt("ramp_up_required_breaches_min", DEFAULT_BREACHES_MIN, 1, 10);
    int breachesMax = reader.readInt("ramp_up_required_breaches_max", DEFAULT_BREACHES_MAX, 1, 20);
    if (breachesMin > breachesMax) {
      log.warn("ramp_up_required_breaches_min ({}) exceeds max ({}), using defaults: {}..{}",
        breachesMin, breachesMax, DEFAULT_BREACHES_MIN, DEFAULT_BREACHES_MAX);
      breachesMin = DEFAULT_BREACHES_MIN;
      breachesMax = DEFAULT_BREACHES_MAX;
    }
    return new SegmentationSettings(
      reader.readInt("rolling_window", DEFAULT_ROLLING_WINDOW, 2, 20),
      reader.readDouble("rolling_correlation_threshold", DEFAULT_CORRELATION_THRESHOLD, 0.0, 1.0),
      breachesMin,
      breachesMax,
      reader.readDouble("ramp_up_required_breaches_fraction", DEFAULT_BREACHES_FRACTION, 0.01, 0.5),
      reader.readString("ramp_up_base_metric", MetricNames.USERS),
      reader.readDouble("load_stability_cv", DEFAULT_LOAD_STABILITY_CV, 0.0, 1.0),
      reader.readDouble("fixed_load_percentage", DEFAULT_FIXED_LOAD_PERCENTAGE, 0.0, 100.0)
    );
  }
}
