package io.github.themoah.loadlens.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of one analysis run.
 *
 * @param status {@link Status#OK} or {@link Status#INSUFFICIENT_DATA}
 * @param mode detection mode, {@code null} when there was nothing to analyze
 * @param segmentation timeline split, {@code null} when there was nothing to analyze
 * @param events ranked events, highest impact first
 * @param windowsByScope extracted windows keyed by scope, then metric
 * @param transactionSelection transactions chosen for per-transaction analysis
 * @param trendFindings whole-series trend assessment per overall metric
 */
public record AnalysisResult(
  Status status,
  AnalysisMode mode,
  Segmentation segmentation,
  List<MergedEvent> events,
  Map<String, Map<String, List<AnomalyWindow>>> windowsByScope,
  TransactionSelection transactionSelection,
  List<TrendFinding> trendFindings
) {

  public AnalysisResult {
    events = List.copyOf(events);
    windowsByScope = copyWindows(windowsByScope);
    trendFindings = List.copyOf(trendFindings);
  }

  public static AnalysisResult insufficientData() {
    return new AnalysisResult(Status.INSUFFICIENT_DATA, null, null, List.of(), Map.of(),
      TransactionSelection.empty(), List.of());
  }

  public boolean isInsufficientData() {
    return status == Status.INSUFFICIENT_DATA;
  }

  private static Map<String, Map<String, List<AnomalyWindow>>> copyWindows(
    Map<String, Map<String, List<AnomalyWindow>>> windowsByScope) {
    Map<String, Map<String, List<AnomalyWindow>>> scopes = new TreeMap<>();
    windowsByScope.forEach((scope, byMetric) -> {
      Map<String, List<AnomalyWindow>> metrics = new TreeMap<>();
      byMetric.forEach((metric, windows) -> metrics.put(metric, List.copyOf(windows)));
      scopes.put(scope, Collections.unmodifiableMap(metrics));
    });
    return Collections.unmodifiableMap(scopes);
  }

  /**
   * Run outcome.
   */
  public enum Status {
    OK,
    INSUFFICIENT_DATA;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
