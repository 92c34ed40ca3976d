package io.github.themoah.loadlens.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Severity bands and the impact floor.
 *
 * <p>Band thresholds are fractions of the effect size: 0.25 means a 25% deviation.
 *
 * @param severityMedium lower bound of the medium band
 * @param severityHigh lower bound of the high band
 * @param severityCritical lower bound of the critical band
 * @param minImpact events with a lower impact are dropped from the ranking
 */
public record ScoringSettings(
  double severityMedium,
  double severityHigh,
  double severityCritical,
  double minImpact
) {

  private static final Logger log = LoggerFactory.getLogger(ScoringSettings.class);

  static final double DEFAULT_MEDIUM = 0.25;
  static final double DEFAULT_HIGH = 0.40;
  static final double DEFAULT_CRITICAL = 0.60;

  public static ScoringSettings defaults() {
    return new ScoringSettings(DEFAULT_MEDIUM, DEFAULT_HIGH, DEFAULT_CRITICAL, 0.0);
  }

  static ScoringSettings read(SettingsReader reader) {
    double medium = reader.readDouble("severity_medium", DEFAULT_MEDIUM, 0.0, 1.0);
    double high = reader.readDouble("severity_high", DEFAULT_HIGH, 0.0, 1.0);
    double critical = reader.readDouble("severity_critical", DEFAULT_CRITICAL, 0.0, 1.0);
    if (!(medium <= high && high <= critical)) {
      log.warn("Severity bands must be ordered (medium={}, high={}, critical={}), using defaults",
        medium, high, critical);
      medium = DEFAULT_MEDIUM;
      high = DEFAULT_HIGH;
      critical = DEFAULT_CRITICAL;
    }
    double minImpact = reader.readDouble("min_impact", 0.0, 0.0, Double.MAX_VALUE);
    return new ScoringSettings(medium, high, critical, minImpact);
  }
}
