package io.github.themoah.loadlens.analysis.detector;

/**
 * A per-metric anomaly detector producing one flag per sample.
 *
 * <p>Implementations must be deterministic: the same series and context
 * always produce the same flags.
 */
public interface MetricDetector {

  /**
   * Name recorded as provenance on flagged samples.
   */
  String name();

  /**
   * Whether the detector runs for this scope, metric and mode.
   */
  boolean appliesTo(DetectionContext context);

  /**
   * Flags anomalous samples.
   *
   * @param series the metric values, {@code NaN} for missing samples
   * @param context the scope, mode and settings of the run
   * @return an array of the same length as {@code series}
   */
  boolean[] detect(double[] series, DetectionContext context);

  /**
   * Whether candidate flags are re-checked against the local neighborhood median.
   */
  default boolean contextFiltered() {
    return false;
  }
}
