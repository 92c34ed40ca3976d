package io.github.themoah.loadlens.analysis;

import java.util.Arrays;

/**
 * Statistical helpers shared by segmentation, detectors and window extraction.
 *
 * <p>All array-based methods skip {@code NaN} entries, which is how missing
 * samples are represented in a {@link io.github.themoah.loadlens.model.ScopeFrame}.
 */
public final class StatisticalUtils {

  public static final double EPSILON = 1e-10;

  private StatisticalUtils() {}

  /**
   * Calculates mean and population standard deviation over {@code values[from, to)}.
   *
   * @param values the values to analyze
   * @param from first index (inclusive)
   * @param to last index (exclusive)
   * @return statistics, or {@code Stats(NaN, NaN, 0)} when no finite value is present
   */
  public static Stats calculateStats(double[] values, int from, int to) {
    int lo = Math.max(0, from);
    int hi = Math.min(values.length, to);
    int n = 0;
    double sum = 0.0;
    for (int i = lo; i < hi; i++) {
      if (!Double.isNaN(values[i])) {
        sum += values[i];
        n++;
      }
    }
    if (n == 0) {
      return new Stats(Double.NaN, Double.NaN, 0);
    }
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (int i = lo; i < hi; i++) {
      if (!Double.isNaN(values[i])) {
        double diff = values[i] - mean;
        sumSquaredDiffs += diff * diff;
      }
    }
    return new Stats(mean, Math.sqrt(sumSquaredDiffs / n), n);
  }

  public static Stats calculateStats(double[] values) {
    return calculateStats(values, 0, values.length);
  }

  /**
   * Mean of the finite values in {@code values[from, to)}, or {@code NaN} when there are none.
   */
  public static double mean(double[] values, int from, int to) {
    return calculateStats(values, from, to).mean();
  }

  public static double mean(double[] values) {
    return mean(values, 0, values.length);
  }

  /**
   * Median of the finite values in {@code values[from, to)}, or {@code NaN} when there are none.
   */
  public static double median(double[] values, int from, int to) {
    double[] finite = finite(values, from, to);
    if (finite.length == 0) {
      return Double.NaN;
    }
    Arrays.sort(finite);
    int mid = finite.length / 2;
    if (finite.length % 2 == 1) {
      return finite[mid];
    }
    return (finite[mid - 1] + finite[mid]) / 2.0;
  }

  public static double median(double[] values) {
    return median(values, 0, values.length);
  }

  /**
   * Linear-interpolated quantile (numpy "linear" method) of the finite values.
   *
   * @param values the values
   * @param q quantile in [0, 1]
   */
  public static double quantile(double[] values, double q) {
    double[] finite = finite(values, 0, values.length);
    if (finite.length == 0) {
      return Double.NaN;
    }
    Arrays.sort(finite);
    double pos = Math.max(0.0, Math.min(1.0, q)) * (finite.length - 1);
    int lower = (int) Math.floor(pos);
    int upper = (int) Math.ceil(pos);
    double fraction = pos - lower;
    return finite[lower] + (finite[upper] - finite[lower]) * fraction;
  }

  /**
   * Counts finite values in {@code values[from, to)}.
   */
  public static int countFinite(double[] values, int from, int to) {
    int n = 0;
    for (int i = Math.max(0, from); i < Math.min(values.length, to); i++) {
      if (!Double.isNaN(values[i])) {
        n++;
      }
    }
    return n;
  }

  /**
   * Pearson correlation of paired samples in {@code [from, to)}; pairs with a
   * missing side are ignored.
   *
   * @return the correlation, or {@code NaN} when fewer than two pairs exist or
   *     either side has no variance
   */
  public static double pearson(double[] x, double[] y, int from, int to) {
    int lo = Math.max(0, from);
    int hi = Math.min(Math.min(x.length, y.length), to);
    int n = 0;
    double sumX = 0, sumY = 0;
    for (int i = lo; i < hi; i++) {
      if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
        sumX += x[i];
        sumY += y[i];
        n++;
      }
    }
    if (n < 2) {
      return Double.NaN;
    }
    double meanX = sumX / n;
    double meanY = sumY / n;
    double cov = 0, varX = 0, varY = 0;
    for (int i = lo; i < hi; i++) {
      if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
        double dx = x[i] - meanX;
        double dy = y[i] - meanY;
        cov += dx * dy;
        varX += dx * dx;
        varY += dy * dy;
      }
    }
    if (varX < EPSILON || varY < EPSILON) {
      return Double.NaN;
    }
    return cov / Math.sqrt(varX * varY);
  }

  /**
   * Coefficient of variation (population std / |mean|) over {@code [from, to)}.
   *
   * @return the CV, 0 for a flat window, or {@code NaN} when the mean is ~0 or no data exists
   */
  public static double coefficientOfVariation(double[] values, int from, int to) {
    Stats stats = calculateStats(values, from, to);
    if (stats.count() == 0) {
      return Double.NaN;
    }
    if (stats.stdDev() < EPSILON) {
      return 0.0;
    }
    if (Math.abs(stats.mean()) < EPSILON) {
      return Double.NaN;
    }
    return stats.stdDev() / Math.abs(stats.mean());
  }

  /**
   * Fits {@code y = slope * x + b} against the sample index over {@code [from, to)}
   * using Ordinary Least Squares and tests the slope for significance.
   *
   * <p>Same expanded form as the velocity regression:
   * {@code slope = (Σ(x*y) - n*mean_x*mean_y) / (Σ(x²) - n*mean_x²)}.
   * The p-value is the two-sided Student t-test of {@code slope / se(slope)} with
   * {@code n - 2} degrees of freedom.
   *
   * @return the fit, or {@code null} when fewer than three finite points exist
   */
  public static LinearFit linearRegression(double[] values, int from, int to) {
    int lo = Math.max(0, from);
    int hi = Math.min(values.length, to);
    int n = 0;
    double sumX = 0, sumY = 0, sumXY = 0, sumXSquared = 0;
    for (int i = lo; i < hi; i++) {
      if (Double.isNaN(values[i])) {
        continue;
      }
      double x = i - lo;
      double y = values[i];
      sumX += x;
      sumY += y;
      sumXY += x * y;
      sumXSquared += x * x;
      n++;
    }
    if (n < 3) {
      return null;
    }
    double meanX = sumX / n;
    double meanY = sumY / n;
    double numerator = sumXY - n * meanX * meanY;
    double denominator = sumXSquared - n * meanX * meanX;
    if (Math.abs(denominator) < EPSILON) {
      return null;
    }
    double slope = numerator / denominator;
    double intercept = meanY - slope * meanX;

    double sse = 0.0;
    for (int i = lo; i < hi; i++) {
      if (Double.isNaN(values[i])) {
        continue;
      }
      double residual = values[i] - (intercept + slope * (i - lo));
      sse += residual * residual;
    }
    int df = n - 2;
    double standardError = Math.sqrt((sse / df) / denominator);
    double pValue;
    if (standardError < EPSILON) {
      // Perfect fit: any non-zero slope is maximally significant
      pValue = Math.abs(slope) < EPSILON ? 1.0 : 0.0;
    } else {
      pValue = studentTTwoSidedPValue(slope / standardError, df);
    }
    return new LinearFit(slope, intercept, pValue, n);
  }

  /**
   * Two-sided p-value of a Student t statistic: {@code I_x(df/2, 1/2)} with
   * {@code x = df / (df + t²)}.
   */
  public static double studentTTwoSidedPValue(double t, int df) {
    if (df <= 0 || Double.isNaN(t)) {
      return Double.NaN;
    }
    if (Double.isInfinite(t)) {
      return 0.0;
    }
    double x = df / (df + t * t);
    return regularizedIncompleteBeta(x, df / 2.0, 0.5);
  }

  /**
   * Regularized incomplete beta function {@code I_x(a, b)} via Lentz's continued fraction.
   */
  static double regularizedIncompleteBeta(double x, double a, double b) {
    if (x <= 0.0) {
      return 0.0;
    }
    if (x >= 1.0) {
      return 1.0;
    }
    double logFront = logGamma(a + b) - logGamma(a) - logGamma(b)
      + a * Math.log(x) + b * Math.log(1.0 - x);
    // The continued fraction converges fastest for x < (a + 1) / (a + b + 2)
    if (x < (a + 1.0) / (a + b + 2.0)) {
      return Math.exp(logFront) * betaContinuedFraction(x, a, b) / a;
    }
    return 1.0 - Math.exp(logFront) * betaContinuedFraction(1.0 - x, b, a) / b;
  }

  private static double betaContinuedFraction(double x, double a, double b) {
    final int maxIterations = 300;
    final double tiny = 1e-300;
    double qab = a + b;
    double qap = a + 1.0;
    double qam = a - 1.0;
    double c = 1.0;
    double d = 1.0 - qab * x / qap;
    if (Math.abs(d) < tiny) {
      d = tiny;
    }
    d = 1.0 / d;
    double h = d;
    for (int m = 1; m <= maxIterations; m++) {
      int m2 = 2 * m;
      double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
      d = 1.0 + aa * d;
      if (Math.abs(d) < tiny) {
        d = tiny;
      }
      c = 1.0 + aa / c;
      if (Math.abs(c) < tiny) {
        c = tiny;
      }
      d = 1.0 / d;
      h *= d * c;
      aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
      d = 1.0 + aa * d;
      if (Math.abs(d) < tiny) {
        d = tiny;
      }
      c = 1.0 + aa / c;
      if (Math.abs(c) < tiny) {
        c = tiny;
      }
      d = 1.0 / d;
      double delta = d * c;
      h *= delta;
      if (Math.abs(delta - 1.0) < 1e-14) {
        break;
      }
    }
    return h;
  }

  /**
   * Natural log of the gamma function (Lanczos approximation, g=7, n=9).
   */
  static double logGamma(double x) {
    final double[] coefficients = {
      0.99999999999980993, 676.5203681218851, -1259.1392167224028,
      771.32342877765313, -176.61502916214059, 12.507343278686905,
      -0.13857109526572012, 9.9843695780195716e-6, 1.5056327351493116e-7
    };
    if (x < 0.5) {
      return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1.0 - x);
    }
    double z = x - 1.0;
    double sum = coefficients[0];
    for (int i = 1; i < coefficients.length; i++) {
      sum += coefficients[i] / (z + i);
    }
    double t = z + 7.5;
    return 0.5 * Math.log(2 * Math.PI) + (z + 0.5) * Math.log(t) - t + Math.log(sum);
  }

  /**
   * Determines if a value deviates from the mean by more than
   * {@code sigmaMultiplier * stdDev} in either direction.
   *
   * @return false when there is no variance: a flat signal has no outliers
   */
  public static boolean isOutlier(double value, double mean, double stdDev, double sigmaMultiplier) {
    if (Double.isNaN(value) || Double.isNaN(stdDev) || stdDev < EPSILON) {
      return false;
    }
    return Math.abs(value - mean) > sigmaMultiplier * stdDev;
  }

  /**
   * Calculates the z-score for a value.
   *
   * @return (value - mean) / stdDev, or 0 if stdDev is near zero
   */
  public static double zScore(double value, double mean, double stdDev) {
    if (stdDev < EPSILON) {
      return 0.0;
    }
    return (value - mean) / stdDev;
  }

  /**
   * Median interval between consecutive timestamps in milliseconds, or 0 for fewer than two.
   */
  public static long medianInterval(long[] timestamps) {
    if (timestamps.length < 2) {
      return 0L;
    }
    double[] diffs = new double[timestamps.length - 1];
    for (int i = 1; i < timestamps.length; i++) {
      diffs[i - 1] = timestamps[i] - timestamps[i - 1];
    }
    return Math.round(median(diffs));
  }

  private static double[] finite(double[] values, int from, int to) {
    int lo = Math.max(0, from);
    int hi = Math.min(values.length, to);
    double[] out = new double[Math.max(0, hi - lo)];
    int n = 0;
    for (int i = lo; i < hi; i++) {
      if (!Double.isNaN(values[i])) {
        out[n++] = values[i];
      }
    }
    return Arrays.copyOf(out, n);
  }

  /**
   * Mean, population standard deviation and number of finite values.
   */
  public record Stats(double mean, double stdDev, int count) {}

  /**
   * OLS fit against sample index.
   *
   * @param slope change per sample
   * @param intercept fitted value at the first sample
   * @param pValue two-sided significance of the slope
   * @param count number of points used
   */
  public record LinearFit(double slope, double intercept, double pValue, int count) {}
}
