package io.github.themoah.loadlens.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The union of one or more overlapping {@link AnomalyWindow}s within one scope.
 *
 * @param scope the scope
 * @param start epoch millis of the earliest window start
 * @param end epoch millis of the latest window end
 * @param metrics contributing metrics, one entry per metric
 * @param volume traffic carried by the scope
 * @param severity maximum contributing severity
 * @param impact ranking score, never negative
 * @param methods detectors involved
 * @param direction direction of the strongest contributing metric
 * @param contributors overlapping transaction events (overall events only)
 */
public record MergedEvent(
  String scope,
  long start,
  long end,
  List<MetricContribution> metrics,
  TrafficVolume volume,
  Severity severity,
  double impact,
  Set<String> methods,
  Direction direction,
  List<TransactionContribution> contributors
) {

  public MergedEvent {
    if (metrics == null || metrics.isEmpty()) {
      throw new IllegalArgumentException("A merged event needs at least one contributing metric");
    }
    if (impact < 0 || Double.isNaN(impact)) {
      throw new IllegalArgumentException("Impact must be a non-negative number: " + impact);
    }
    metrics = List.copyOf(metrics);
    methods = Collections.unmodifiableSortedSet(new TreeSet<>(methods));
    contributors = contributors == null ? List.of() : List.copyOf(contributors);
  }

  public double durationSec() {
    return (end - start) / 1000.0;
  }

  public boolean isOverall() {
    return ScopeFrame.OVERALL.equals(scope);
  }

  public MergedEvent withVolume(TrafficVolume newVolume) {
    return new MergedEvent(scope, start, end, metrics, newVolume, severity, impact, methods, direction, contributors);
  }

  public MergedEvent withImpact(double newImpact) {
    return new MergedEvent(scope, start, end, metrics, volume, severity, newImpact, methods, direction, contributors);
  }

  public MergedEvent withContributors(List<TransactionContribution> newContributors) {
    return new MergedEvent(scope, start, end, metrics, volume, severity, impact, methods, direction, newContributors);
  }
}
