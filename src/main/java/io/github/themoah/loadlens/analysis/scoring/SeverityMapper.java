package io.github.themoah.loadlens.analysis.scoring;

import io.github.themoah.loadlens.config.ScoringSettings;
import io.github.themoah.loadlens.model.Severity;

/**
 * Maps an effect size to a severity band.
 *
 * <p>The effect size is {@code min(1, |delta_pct| / 100)} and is compared
 * against the configured critical, high and medium lower bounds.
 */
public class SeverityMapper {

  private final ScoringSettings settings;

  public SeverityMapper(ScoringSettings settings) {
    this.settings = settings;
  }

  public Severity map(double deltaPct) {
    if (Double.isNaN(deltaPct)) {
      return Severity.LOW;
    }
    double effect = Math.min(1.0, Math.abs(deltaPct) / 100.0);
    if (effect >= settings.severityCritical()) {
      return Severity.CRITICAL;
    }
    if (effect >= settings.severityHigh()) {
      return Severity.HIGH;
    }
    if (effect >= settings.severityMedium()) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }
}
