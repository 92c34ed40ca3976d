package io.github.themoah.loadlens.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A maximal (gap-bridged) run of anomalous samples for one metric within one scope.
 *
 * @param scope the scope the window belongs to
 * @param metric the metric name
 * @param startIndex first sample index within the analyzed series
 * @param endIndex last sample index within the analyzed series
 * @param start epoch millis of the first sample
 * @param end epoch millis of the last sample
 * @param deltaPct percentage deviation of the window mean from its local baseline
 * @param severity severity band of {@code |deltaPct|}
 * @param detectors names of the detectors that flagged samples in the window
 * @param direction whether the window sits above or below the baseline
 * @param baseline the local baseline value
 * @param peakValue the most extreme value in the window's direction
 */
public record AnomalyWindow(
  String scope,
  String metric,
  int startIndex,
  int endIndex,
  long start,
  long end,
  double deltaPct,
  Severity severity,
  Set<String> detectors,
  Direction direction,
  double baseline,
  double peakValue
) {

  public AnomalyWindow {
    if (start > end || startIndex > endIndex) {
      throw new IllegalArgumentException("Window start must not be after its end: " + start + " > " + end);
    }
    detectors = Collections.unmodifiableSortedSet(new TreeSet<>(detectors));
  }

  public double durationSec() {
    return (end - start) / 1000.0;
  }
}
