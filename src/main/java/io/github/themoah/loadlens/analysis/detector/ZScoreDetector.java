package io.github.themoah.loadlens.analysis.detector;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.analysis.StatisticalUtils.Stats;
import io.github.themoah.loadlens.config.DetectorSettings;

/**
 * Flags samples that deviate from their rolling baseline by more than
 * {@code z_score_threshold} standard deviations and from the series median by
 * more than {@code zscore_median_pct}.
 *
 * <p>The baseline is up to {@code zscore_window} preceding samples, or the
 * following samples near the start of the series. A flat baseline borrows the
 * standard deviation of the whole series, so the first sample leaving a flat
 * stretch is still measured. A perfectly flat series raises no flags. The first
 * and last samples are never flagged.
 */
public class ZScoreDetector implements MetricDetector {

  public static final String NAME = "zscore";
  private static final int MIN_BASELINE = 3;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean appliesTo(DetectionContext context) {
    return context.settings().zScoreEnabled();
  }

  @Override
  public boolean contextFiltered() {
    return true;
  }

  @Override
  public boolean[] detect(double[] series, DetectionContext context) {
    DetectorSettings settings = context.settings();
    int n = series.length;
    boolean[] flags = new boolean[n];
    if (StatisticalUtils.countFinite(series, 0, n) < MIN_BASELINE + 1) {
      return flags;
    }
    double median = StatisticalUtils.median(series);
    double seriesStdDev = StatisticalUtils.calculateStats(series).stdDev();
    int window = settings.zScoreWindow();

    for (int i = 1; i < n - 1; i++) {
      double value = series[i];
      if (Double.isNaN(value)) {
        continue;
      }
      Stats baseline = StatisticalUtils.calculateStats(series, i - window, i);
      if (baseline.count() < MIN_BASELINE) {
        baseline = StatisticalUtils.calculateStats(series, i + 1, i + 1 + window);
      }
      if (baseline.count() < MIN_BASELINE) {
        continue;
      }
      double stdDev = baseline.stdDev() < StatisticalUtils.EPSILON ? seriesStdDev : baseline.stdDev();
      if (!StatisticalUtils.isOutlier(value, baseline.mean(), stdDev, settings.zScoreThreshold())) {
        continue;
      }
      flags[i] = deviatesFromMedian(value, median, settings.zScoreMedianPct());
    }
    return flags;
  }

  static boolean deviatesFromMedian(double value, double median, double pct) {
    double diff = Math.abs(value - median);
    if (Math.abs(median) < StatisticalUtils.EPSILON) {
      return diff > StatisticalUtils.EPSILON;
    }
    return diff / Math.abs(median) > pct;
  }
}
