package io.github.themoah.loadlens.analysis.detector;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.analysis.StatisticalUtils.Stats;
import io.github.themoah.loadlens.config.DetectorSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multivariate outlier detector pairing the analyzed metric with
 * {@code isf_feature_metric}.
 *
 * <p>Features are standardized, a seeded forest is grown per run and the
 * decision score is {@code score - offset}, where the offset is the
 * {@code contamination} quantile of the training scores. Candidates below
 * {@code isf_threshold} must also deviate from the series median by
 * {@code isf_median_pct}. The first and last usable rows are never flagged.
 */
public class IsolationForestDetector implements MetricDetector {

  private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

  public static final String NAME = "isolation_forest";
  static final int MIN_ROWS = 8;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean appliesTo(DetectionContext context) {
    return context.settings().isolationForestEnabled();
  }

  @Override
  public boolean contextFiltered() {
    return true;
  }

  @Override
  public boolean[] detect(double[] series, DetectionContext context) {
    DetectorSettings settings = context.settings();
    boolean[] flags = new boolean[series.length];

    double[] feature = null;
    String featureMetric = settings.isolationForestFeatureMetric();
    if (!featureMetric.equals(context.metric())) {
      feature = context.frame().values(featureMetric);
      if (feature == null) {
        log.debug("Feature metric {} missing in scope {}, using {} alone",
          featureMetric, context.scope(), context.metric());
      }
    }

    List<Integer> usable = new ArrayList<>();
    for (int i = 0; i < series.length; i++) {
      if (!Double.isNaN(series[i]) && (feature == null || !Double.isNaN(feature[i]))) {
        usable.add(i);
      }
    }
    if (usable.size() < MIN_ROWS) {
      return flags;
    }

    double[][] rows = standardize(series, feature, usable);
    IsolationForest forest = IsolationForest.fit(rows, settings.isolationForestTrees(),
      new Random(settings.isolationForestSeed()));
    double[] scores = forest.scoreSamples(rows);
    double offset = StatisticalUtils.quantile(scores, settings.contamination());
    double median = StatisticalUtils.median(series);

    for (int r = 1; r < usable.size() - 1; r++) {
      double decision = scores[r] - offset;
      if (decision >= settings.isolationForestThreshold()) {
        continue;
      }
      int index = usable.get(r);
      flags[index] = ZScoreDetector.deviatesFromMedian(series[index], median, settings.isolationForestMedianPct());
    }
    return flags;
  }

  private static double[][] standardize(double[] series, double[] feature, List<Integer> usable) {
    int columns = feature == null ? 1 : 2;
    double[] first = new double[usable.size()];
    double[] second = new double[usable.size()];
    for (int r = 0; r < usable.size(); r++) {
      first[r] = series[usable.get(r)];
      second[r] = feature == null ? 0.0 : feature[usable.get(r)];
    }
    Stats firstStats = StatisticalUtils.calculateStats(first);
    Stats secondStats = StatisticalUtils.calculateStats(second);

    double[][] rows = new double[usable.size()][columns];
    for (int r = 0; r < usable.size(); r++) {
      rows[r][0] = StatisticalUtils.zScore(first[r], firstStats.mean(), firstStats.stdDev());
      if (columns == 2) {
        rows[r][1] = StatisticalUtils.zScore(second[r], secondStats.mean(), secondStats.stdDev());
      }
    }
    return rows;
  }
}
