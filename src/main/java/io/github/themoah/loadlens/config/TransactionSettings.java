package io.github.themoah.loadlens.config;

import io.github.themoah.loadlens.model.MetricNames;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for transaction selection and per-transaction analysis.
 *
 * @param enabled whether per-transaction analysis runs at all
 * @param requireOverallAnomaly only analyze transactions when the overall scope has an anomaly
 * @param policy how the retained prefix is chosen
 * @param coverage cumulative traffic share targeted by the coverage policy
 * @param maxK maximum number of transactions analyzed
 * @param minPoints minimum fixed-load samples a transaction needs
 * @param minRps minimum mean requests per second a transaction needs
 * @param metrics per-transaction metrics to analyze
 */
public record TransactionSettings(
  boolean enabled,
  boolean requireOverallAnomaly,
  SelectionPolicy policy,
  double coverage,
  int maxK,
  int minPoints,
  double minRps,
  List<String> metrics
) {

  private static final Logger log = LoggerFactory.getLogger(TransactionSettings.class);

  static final List<String> DEFAULT_METRICS = List.of(
    MetricNames.TXN_RT_AVG, MetricNames.TXN_RT_MEDIAN, MetricNames.TXN_RT_P90,
    MetricNames.ERROR_RATE, MetricNames.TXN_RPS);

  public TransactionSettings {
    metrics = List.copyOf(metrics);
  }

  public static TransactionSettings defaults() {
    return read(new SettingsReader(null));
  }

  static TransactionSettings read(SettingsReader reader) {
    return new TransactionSettings(
      reader.readBoolean("per_txn_enabled", true),
      reader.readBoolean("per_txn_require_overall_anomaly", false),
      SelectionPolicy.parse(reader.readString("per_txn_selection_policy", "coverage")),
      reader.readDouble("per_txn_coverage", 0.8, 0.1, 1.0),
      reader.readInt("per_txn_max_k", 50, 1, 200),
      reader.readInt("per_txn_min_points", 6, 3, 100),
      reader.readDouble("per_txn_min_rps", 0.1, 0.0, Double.MAX_VALUE),
      reader.readList("per_txn_metrics", DEFAULT_METRICS)
    );
  }

  /**
   * Policy for choosing which eligible transactions are analyzed.
   */
  public enum SelectionPolicy {
    /** Keep the {@code maxK} highest-share transactions. */
    TOP_K,
    /** Keep the smallest prefix reaching the coverage share, capped at {@code maxK}. */
    COVERAGE;

    static SelectionPolicy parse(String value) {
      String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      try {
        return SelectionPolicy.valueOf(normalized);
      } catch (IllegalArgumentException e) {
        log.warn("Unknown per_txn_selection_policy: '{}', using default: coverage", value);
        return COVERAGE;
      }
    }
  }
}
