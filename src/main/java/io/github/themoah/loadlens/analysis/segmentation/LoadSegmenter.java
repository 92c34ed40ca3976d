package io.github.themoah.loadlens.analysis.segmentation;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.analysis.StatisticalUtils.Stats;
import io.github.themoah.loadlens.config.SegmentationSettings;
import io.github.themoah.loadlens.model.MetricNames;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Segmentation;
import io.github.themoah.loadlens.model.Segmentation.SaturationPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the overall timeline into ramp-up and fixed load.
 *
 * <p>While load is ramping, throughput follows the base metric and their rolling
 * correlation is high. The tipping point is confirmed once the correlation stays
 * below the threshold for a number of consecutive samples; the fixed-load phase
 * starts at the first window of that run.
 */
public class LoadSegmenter {

  private static final Logger log = LoggerFactory.getLogger(LoadSegmenter.class);

  private final SegmentationSettings settings;

  public LoadSegmenter(SegmentationSettings settings) {
    this.settings = settings;
  }

  /**
   * Segments the overall frame.
   *
   * @param overall the overall frame, must not be empty
   * @return the segmentation; without a base metric the whole series is treated as
   *     not stable so the caller falls back to loose mode
   */
  public Segmentation segment(ScopeFrame overall) {
    double[] base = overall.values(settings.baseMetric());
    double[] throughput = overall.values(MetricNames.THROUGHPUT);
    long firstTimestamp = overall.timestampAt(0);

    if (base == null) {
      log.debug("Base metric {} missing, no segmentation possible", settings.baseMetric());
      return new Segmentation(0, firstTimestamp, false, 0.0, false, null);
    }

    double stableFraction = stableFraction(base);
    boolean fixedLoad = stableFraction * 100.0 >= settings.fixedLoadPercentage();

    if (throughput == null) {
      log.debug("Throughput missing, whole series treated as fixed load candidate");
      return new Segmentation(0, firstTimestamp, false, stableFraction, fixedLoad, null);
    }

    TippingPoint tippingPoint = findTippingPoint(base, throughput);
    if (tippingPoint == null) {
      log.debug("No tipping point found, stableFraction={}, fixedLoad={}", stableFraction, fixedLoad);
      return new Segmentation(0, firstTimestamp, false, stableFraction, fixedLoad, null);
    }

    int split = tippingPoint.splitIndex();
    SaturationPoint saturation = null;
    if (tippingPoint.loadStillRising()) {
      int at = tippingPoint.saturationIndex();
      saturation = new SaturationPoint(overall.timestampAt(at), throughput[at], base[at]);
      log.info("Throughput stopped following {} at load {} (throughput {})",
        settings.baseMetric(), base[at], throughput[at]);
    }
    log.info("Fixed load starts at sample {} of {}, stableFraction={}, fixedLoad={}",
      split, overall.size(), String.format("%.2f", stableFraction), fixedLoad);
    return new Segmentation(split, overall.timestampAt(split), true, stableFraction, fixedLoad, saturation);
  }

  TippingPoint findTippingPoint(double[] base, double[] throughput) {
    int window = settings.rollingWindow();
    int n = Math.min(base.length, throughput.length);
    if (n < window) {
      return null;
    }

    // NaN = undefined, 1 = breach, 0 = no breach
    double[] breaches = new double[n];
    boolean[] flatBase = new boolean[n];
    int effective = 0;
    for (int i = 0; i < n; i++) {
      breaches[i] = Double.NaN;
      if (i < window - 1) {
        continue;
      }
      int from = i - window + 1;
      if (pairedCount(base, throughput, from, i + 1) < 2) {
        continue;
      }
      double correlation = StatisticalUtils.pearson(base, throughput, from, i + 1);
      // a flat side leaves the correlation undefined: throughput is not following load
      breaches[i] = Double.isNaN(correlation) || correlation < settings.correlationThreshold() ? 1 : 0;
      flatBase[i] = isFlat(base, from, i + 1);
      effective++;
    }

    int required = requiredBreaches(effective);
    int consecutive = 0;
    int firstBreach = -1;
    for (int i = 0; i < n; i++) {
      if (breaches[i] == 1) {
        if (consecutive == 0) {
          firstBreach = i;
        }
        consecutive++;
        if (consecutive >= required) {
          int split = Math.max(0, firstBreach - window + 1);
          boolean rising = !flatBase[firstBreach] && keepsRising(base, firstBreach);
          return new TippingPoint(split, Math.max(0, firstBreach - 1), rising);
        }
      } else {
        consecutive = 0;
      }
    }
    return null;
  }

  int requiredBreaches(int effective) {
    if (effective <= 0) {
      return settings.requiredBreachesMax();
    }
    int scaled = (int) Math.floor(settings.requiredBreachesFraction() * effective);
    return Math.min(settings.requiredBreachesMax(), Math.max(settings.requiredBreachesMin(), scaled));
  }

  /**
   * Fraction of samples whose trailing rolling CV of the base metric is within
   * {@code load_stability_cv}. Samples without a full window count as not stable.
   */
  double stableFraction(double[] base) {
    int window = settings.rollingWindow();
    if (base.length == 0) {
      return 0.0;
    }
    int stable = 0;
    for (int i = window - 1; i < base.length; i++) {
      double cv = StatisticalUtils.coefficientOfVariation(base, i - window + 1, i + 1);
      if (!Double.isNaN(cv) && cv <= settings.loadStabilityCv()) {
        stable++;
      }
    }
    return (double) stable / base.length;
  }

  /**
   * Whether the base metric grows past its level at {@code index} by more than the
   * stability tolerance later in the series.
   */
  private boolean keepsRising(double[] base, int index) {
    double level = base[index];
    if (Double.isNaN(level)) {
      return false;
    }
    double peak = level;
    for (int i = index + 1; i < base.length; i++) {
      if (!Double.isNaN(base[i]) && base[i] > peak) {
        peak = base[i];
      }
    }
    return peak - level > settings.loadStabilityCv() * Math.abs(level);
  }

  private static int pairedCount(double[] x, double[] y, int from, int to) {
    int n = 0;
    for (int i = from; i < to; i++) {
      if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
        n++;
      }
    }
    return n;
  }

  private static boolean isFlat(double[] values, int from, int to) {
    Stats stats = StatisticalUtils.calculateStats(values, from, to);
    return stats.count() >= 2 && stats.stdDev() < StatisticalUtils.EPSILON;
  }

  record TippingPoint(int splitIndex, int saturationIndex, boolean loadStillRising) {}
}
