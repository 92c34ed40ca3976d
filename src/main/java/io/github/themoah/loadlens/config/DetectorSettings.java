package io.github.themoah.loadlens.config;

import io.github.themoah.loadlens.model.MetricNames;

/**
 * Settings for the per-metric detectors and the contextual median filter.
 *
 * @param zScoreEnabled whether the z-score detector runs
 * @param zScoreThreshold standard deviations from the rolling mean to flag a sample
 * @param zScoreWindow samples in the rolling baseline
 * @param zScoreMedianPct minimum relative deviation from the series median
 * @param isolationForestEnabled whether the isolation forest detector runs
 * @param contamination expected proportion of outliers
 * @param isolationForestThreshold decision score below which a sample is an outlier
 * @param isolationForestFeatureMetric second feature paired with the analyzed metric
 * @param isolationForestTrees number of trees
 * @param isolationForestSeed random seed, fixed so that runs are reproducible
 * @param isolationForestMedianPct minimum relative deviation from the series median
 * @param stabilityEnabled whether the stability/trend detector runs
 * @param stabilityWindow samples in the rolling trend window
 * @param slopeThreshold slope (percent of window mean per sample) treated as a drift
 * @param pValueThreshold significance level for the slope
 * @param varianceThreshold variance of the max-normalized window treated as unstable
 * @param cvThreshold coefficient of variation treated as unstable
 * @param contextMedianEnabled whether candidate flags are checked against the local median
 * @param contextMedianWindow neighbors on each side used for the local median
 * @param contextMedianPct relative distance from the local median required to keep a flag
 * @param looseThresholdFactor z-score threshold multiplier for tests without a fixed load
 */
public record DetectorSettings(
  boolean zScoreEnabled,
  double zScoreThreshold,
  int zScoreWindow,
  double zScoreMedianPct,
  boolean isolationForestEnabled,
  double contamination,
  double isolationForestThreshold,
  String isolationForestFeatureMetric,
  int isolationForestTrees,
  long isolationForestSeed,
  double isolationForestMedianPct,
  boolean stabilityEnabled,
  int stabilityWindow,
  double slopeThreshold,
  double pValueThreshold,
  double varianceThreshold,
  double cvThreshold,
  boolean contextMedianEnabled,
  int contextMedianWindow,
  double contextMedianPct,
  double looseThresholdFactor
) {

  public static DetectorSettings defaults() {
    return read(new SettingsReader(null));
  }

  /**
   * Returns a copy with a different z-score threshold.
   */
  public DetectorSettings withZScoreThreshold(double threshold) {
    return new DetectorSettings(zScoreEnabled, threshold, zScoreWindow, zScoreMedianPct,
      isolationForestEnabled, contamination, isolationForestThreshold, isolationForestFeatureMetric,
      isolationForestTrees, isolationForestSeed, isolationForestMedianPct, stabilityEnabled,
      stabilityWindow, slopeThreshold, pValueThreshold, varianceThreshold, cvThreshold,
      contextMedianEnabled, contextMedianWindow, contextMedianPct, looseThresholdFactor);
  }

  static DetectorSettings read(SettingsReader reader) {
    return new DetectorSettings(
      reader.readBoolean("zscore_enabled", true),
      reader.readDouble("z_score_threshold", 3.0, 1.0, 10.0),
      reader.readInt("zscore_window", 20, 5, 500),
      reader.readDouble("zscore_median_pct", 0.10, 0.0, 1.0),
      reader.readBoolean("isf_enabled", true),
      reader.readDouble("contamination", 0.001, 0.0001, 0.5),
      reader.readDouble("isf_threshold", 0.1, -1.0, 1.0),
      reader.readString("isf_feature_metric", MetricNames.THROUGHPUT),
      reader.readInt("isf_trees", 100, 10, 500),
      reader.readLong("isf_seed", 42L),
      reader.readDouble("isf_median_pct", 0.10, 0.0, 1.0),
      reader.readBoolean("stability_enabled", true),
      reader.readInt("stability_window", 10, 3, 200),
      reader.readDouble("slope_threshold", 1.0, 0.0, 100.0),
      reader.readDouble("p_value_threshold", 0.05, 0.001, 0.2),
      reader.readDouble("variance_threshold", 0.003, 0.0, 0.1),
      reader.readDouble("cv_threshold", 0.07, 0.0, 1.0),
      reader.readBoolean("context_median_enabled", true),
      reader.readInt("context_median_window", 10, 3, 50),
      reader.readDouble("context_median_pct", 0.15, 0.0, 1.0),
      reader.readDouble("loose_threshold_factor", 1.5, 1.0, 5.0)
    );
  }
}
