package io.github.themoah.loadlens.model;

import java.util.Locale;

/**
 * How detectors run for a given test.
 */
public enum AnalysisMode {
  /** Detectors run on the fixed-load phase only. */
  FIXED_LOAD,
  /** Load never stabilized: detectors run on the full series with relaxed settings. */
  LOOSE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
