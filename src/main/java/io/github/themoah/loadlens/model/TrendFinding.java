package io.github.themoah.loadlens.model;

/**
 * Whole-series stability assessment of one overall metric.
 *
 * @param metric the metric name
 * @param trend the trend classification
 * @param slope normalized slope per sample
 * @param cv coefficient of variation
 * @param pValue significance of the slope
 */
public record TrendFinding(
  String metric,
  Trend trend,
  double slope,
  double cv,
  double pValue
) {

  /**
   * Classification of a metric's behavior over the analyzed phase.
   */
  public enum Trend {
    CONSTANT("constant", true),
    NOISY_BUT_STABLE("noisy but stable", true),
    UNSTABLE("unstable", false),
    CONSTANT_INCREASE("constant increase", false),
    CONSTANT_DECREASE("constant decrease", false),
    UNSTABLE_INCREASING("unstable increasing", false),
    UNSTABLE_DECREASING("unstable decreasing", false);

    private final String label;
    private final boolean passed;

    Trend(String label, boolean passed) {
      this.label = label;
      this.passed = passed;
    }

    public String label() {
      return label;
    }

    public boolean passed() {
      return passed;
    }
  }
}
