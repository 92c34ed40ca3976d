package io.github.themoah.loadlens.config;

import io.github.themoah.loadlens.model.MetricNames;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable per-run analysis configuration, resolved once from a project's
 * settings dictionary and passed explicitly to every component.
 *
 * @param overallMetrics overall metrics analyzed for anomalies
 * @param segmentation ramp-up / fixed-load split
 * @param detectors detector thresholds
 * @param windows window extraction and merging
 * @param transactions transaction selection
 * @param scoring severity bands and impact floor
 */
public record AnalysisSettings(
  List<String> overallMetrics,
  SegmentationSettings segmentation,
  DetectorSettings detectors,
  WindowSettings windows,
  TransactionSettings transactions,
  ScoringSettings scoring
) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisSettings.class);

  static final List<String> DEFAULT_OVERALL_METRICS = List.of(
    MetricNames.RT_AVG, MetricNames.RT_MEDIAN, MetricNames.RT_P90,
    MetricNames.THROUGHPUT, MetricNames.ERROR_RATE);

  public AnalysisSettings {
    overallMetrics = List.copyOf(overallMetrics);
  }

  /**
   * Returns the documented defaults.
   */
  public static AnalysisSettings defaults() {
    return fromMap(Map.of());
  }

  /**
   * Resolves settings from a key/value dictionary.
   *
   * <p>Values may be typed ({@link Number}, {@link Boolean}, lists) or strings.
   * Missing keys take their default; invalid or out-of-range values are logged
   * and replaced by their default; unknown keys are logged and ignored.
   *
   * @param values the project settings, may be {@code null}
   * @return the resolved settings
   */
  public static AnalysisSettings fromMap(Map<String, ?> values) {
    SettingsReader reader = new SettingsReader(values);
    AnalysisSettings settings = new AnalysisSettings(
      reader.readList("overall_metrics", DEFAULT_OVERALL_METRICS),
      SegmentationSettings.read(reader),
      DetectorSettings.read(reader),
      WindowSettings.read(reader),
      TransactionSettings.read(reader),
      ScoringSettings.read(reader)
    );
    reader.warnUnknownKeys();
    log.debug("Analysis settings resolved: {}", settings);
    return settings;
  }

  public AnalysisSettings withDetectors(DetectorSettings newDetectors) {
    return new AnalysisSettings(overallMetrics, segmentation, newDetectors, windows, transactions, scoring);
  }
}
