package io.github.themoah.loadlens.analysis.detector;

import io.github.themoah.loadlens.config.DetectorSettings;
import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.ScopeFrame;

/**
 * What a detector knows about the series it is given.
 *
 * @param frame the analyzed phase of the scope, used for auxiliary features
 * @param metric the metric being analyzed
 * @param mode fixed-load or loose detection
 * @param settings detector settings, already adjusted for the mode
 */
public record DetectionContext(
  ScopeFrame frame,
  String metric,
  AnalysisMode mode,
  DetectorSettings settings
) {

  public String scope() {
    return frame.scope();
  }

  public boolean isOverall() {
    return frame.isOverall();
  }
}
