package io.github.themoah.loadlens.analysis.detector;

import io.github.themoah.loadlens.analysis.StatisticalUtils;

/**
 * Drops candidate flags that sit close to their neighborhood median.
 *
 * <p>A flag at {@code i} survives only if
 * {@code |x[i] - median(neighbors)| > pct * |x[i]|}, where the neighbors are up
 * to {@code window} samples on each side, excluding {@code i} itself.
 */
public final class ContextualMedianFilter {

  private final int window;
  private final double pct;

  public ContextualMedianFilter(int window, double pct) {
    this.window = window;
    this.pct = pct;
  }

  public boolean[] filter(boolean[] flags, double[] series) {
    boolean[] kept = flags.clone();
    for (int i = 0; i < kept.length; i++) {
      if (!kept[i] || Double.isNaN(series[i])) {
        continue;
      }
      double[] neighbors = neighbors(series, i);
      double neighborMedian = StatisticalUtils.median(neighbors);
      if (Double.isNaN(neighborMedian)) {
        continue;
      }
      double denominator = Math.max(Math.abs(series[i]), 1e-12);
      if (Math.abs(series[i] - neighborMedian) <= pct * denominator) {
        kept[i] = false;
      }
    }
    return kept;
  }

  private double[] neighbors(double[] series, int index) {
    int from = Math.max(0, index - window);
    int to = Math.min(series.length, index + window + 1);
    double[] neighbors = new double[to - from - 1];
    int n = 0;
    for (int j = from; j < to; j++) {
      if (j != index) {
        neighbors[n++] = series[j];
      }
    }
    return neighbors;
  }
}
