package io.github.themoah.loadlens.analysis.detector;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.analysis.StatisticalUtils.LinearFit;
import io.github.themoah.loadlens.analysis.StatisticalUtils.Stats;
import io.github.themoah.loadlens.config.DetectorSettings;
import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.TrendFinding;
import io.github.themoah.loadlens.model.TrendFinding.Trend;
import java.util.Arrays;

/**
 * Detects drifts and unstable stretches in the overall fixed-load phase.
 *
 * <p>Samples more than three standard deviations from the series mean are
 * dropped first, so isolated spikes do not read as instability. The rest is
 * normalized by its maximum. For every trailing window of
 * {@code stability_window} samples an OLS slope (percent of the window mean per
 * sample) with its p-value, the variance and the CV are computed, and the
 * window's last sample is flagged when the slope is large and significant, or
 * when both variance and CV exceed their thresholds.
 */
public class StabilityTrendDetector implements MetricDetector {

  public static final String NAME = "stability";
  private static final double OUTLIER_SIGMA = 3.0;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean appliesTo(DetectionContext context) {
    return context.settings().stabilityEnabled()
      && context.isOverall()
      && context.mode() == AnalysisMode.FIXED_LOAD;
  }

  @Override
  public boolean[] detect(double[] series, DetectionContext context) {
    DetectorSettings settings = context.settings();
    int n = series.length;
    boolean[] flags = new boolean[n];
    double[] normalized = normalizeByMax(withoutOutliers(series));
    if (normalized == null) {
      return flags;
    }
    int window = settings.stabilityWindow();
    for (int last = window - 1; last < n; last++) {
      if (Double.isNaN(normalized[last])) {
        continue;
      }
      int from = last - window + 1;
      LinearFit fit = StatisticalUtils.linearRegression(normalized, from, last + 1);
      if (fit == null) {
        continue;
      }
      Stats stats = StatisticalUtils.calculateStats(normalized, from, last + 1);
      if (Math.abs(stats.mean()) < StatisticalUtils.EPSILON) {
        continue;
      }
      double slopePct = fit.slope() / Math.abs(stats.mean()) * 100.0;
      double variance = stats.stdDev() * stats.stdDev();
      double cv = stats.stdDev() / Math.abs(stats.mean());

      boolean drifting = Math.abs(slopePct) > settings.slopeThreshold() && fit.pValue() < settings.pValueThreshold();
      boolean unstable = variance > settings.varianceThreshold() && cv > settings.cvThreshold();
      flags[last] = drifting || unstable;
    }
    return flags;
  }

  /**
   * Classifies the whole series after removing outliers beyond three standard deviations.
   *
   * @return the finding, or {@code null} with fewer than three usable samples
   */
  public static TrendFinding assess(String metric, double[] series, DetectorSettings settings) {
    if (StatisticalUtils.countFinite(series, 0, series.length) < 3) {
      return null;
    }
    double[] cleaned = Arrays.stream(withoutOutliers(series)).filter(v -> !Double.isNaN(v)).toArray();
    double[] normalized = normalizeByMax(cleaned);
    if (normalized == null || normalized.length < 3) {
      return null;
    }

    Stats stats = StatisticalUtils.calculateStats(normalized);
    double sampleVariance = stats.stdDev() * stats.stdDev() * normalized.length / (normalized.length - 1);
    if (sampleVariance < settings.varianceThreshold()) {
      return new TrendFinding(metric, Trend.CONSTANT, 0.0, 0.0, 1.0);
    }
    double cv = Math.abs(stats.mean()) < StatisticalUtils.EPSILON ? 0.0 : stats.stdDev() / stats.mean();
    LinearFit fit = StatisticalUtils.linearRegression(normalized, 0, normalized.length);
    double slope = fit == null ? 0.0 : fit.slope();
    double pValue = fit == null ? 1.0 : fit.pValue();
    return new TrendFinding(metric, classify(slope, cv, pValue, settings), slope, cv, pValue);
  }

  static Trend classify(double slope, double cv, double pValue, DetectorSettings settings) {
    boolean significant = pValue < settings.pValueThreshold();
    boolean noisy = cv >= settings.cvThreshold();
    if (!significant) {
      return noisy ? Trend.UNSTABLE : Trend.NOISY_BUT_STABLE;
    }
    if (slope > 0) {
      return noisy ? Trend.UNSTABLE_INCREASING : Trend.CONSTANT_INCREASE;
    }
    return noisy ? Trend.UNSTABLE_DECREASING : Trend.CONSTANT_DECREASE;
  }

  /**
   * Copy of {@code series} with samples three or more standard deviations from the mean replaced by {@code NaN}.
   */
  static double[] withoutOutliers(double[] series) {
    Stats raw = StatisticalUtils.calculateStats(series);
    double[] cleaned = series.clone();
    if (raw.count() == 0 || raw.stdDev() < StatisticalUtils.EPSILON) {
      return cleaned;
    }
    for (int i = 0; i < cleaned.length; i++) {
      if (!Double.isNaN(cleaned[i])
        && Math.abs(StatisticalUtils.zScore(cleaned[i], raw.mean(), raw.stdDev())) >= OUTLIER_SIGMA) {
        cleaned[i] = Double.NaN;
      }
    }
    return cleaned;
  }

  private static double[] normalizeByMax(double[] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      if (!Double.isNaN(value)) {
        max = Math.max(max, value);
      }
    }
    if (max <= 0 || Double.isInfinite(max)) {
      return null;
    }
    double[] normalized = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      normalized[i] = values[i] / max;
    }
    return normalized;
  }
}
