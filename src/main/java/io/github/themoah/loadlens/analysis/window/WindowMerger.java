package io.github.themoah.loadlens.analysis.window;

import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.Direction;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricContribution;
import io.github.themoah.loadlens.model.Severity;
import io.github.themoah.loadlens.model.TrafficVolume;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the windows of one scope into events with a single sort and forward sweep.
 *
 * <p>A window joins the current event when it starts no later than the event's
 * end plus {@code merge_gap_samples} sample intervals.
 */
public class WindowMerger {

  private static final Comparator<AnomalyWindow> ORDER = Comparator
    .comparingLong(AnomalyWindow::start)
    .thenComparingLong(AnomalyWindow::end)
    .thenComparing(AnomalyWindow::metric);

  private static final Comparator<MetricContribution> STRONGEST_FIRST = Comparator
    .comparingDouble((MetricContribution m) -> Math.abs(m.deltaPct())).reversed()
    .thenComparing(MetricContribution::name);

  private final int mergeGapSamples;

  public WindowMerger(int mergeGapSamples) {
    this.mergeGapSamples = mergeGapSamples;
  }

  /**
   * Merges windows into events.
   *
   * @param windows windows of a single scope, any order
   * @param sampleIntervalMs typical spacing of samples in the scope
   * @param volume traffic carried by the scope
   * @return events ordered by start, with zero impact
   */
  public List<MergedEvent> merge(List<AnomalyWindow> windows, long sampleIntervalMs, TrafficVolume volume) {
    List<MergedEvent> events = new ArrayList<>();
    if (windows.isEmpty()) {
      return events;
    }
    long tolerance = mergeGapSamples * Math.max(0L, sampleIntervalMs);
    List<AnomalyWindow> sorted = new ArrayList<>(windows);
    sorted.sort(ORDER);

    List<AnomalyWindow> group = new ArrayList<>();
    long groupEnd = Long.MIN_VALUE;
    for (AnomalyWindow window : sorted) {
      if (!group.isEmpty() && window.start() > groupEnd + tolerance) {
        events.add(toEvent(group, volume));
        group.clear();
      }
      if (group.isEmpty()) {
        groupEnd = window.end();
      } else {
        groupEnd = Math.max(groupEnd, window.end());
      }
      group.add(window);
    }
    events.add(toEvent(group, volume));
    return events;
  }

  private static MergedEvent toEvent(List<AnomalyWindow> group, TrafficVolume volume) {
    long start = Long.MAX_VALUE;
    long end = Long.MIN_VALUE;
    Severity severity = Severity.LOW;
    Set<String> methods = new TreeSet<>();
    Map<String, MetricContribution> byMetric = new TreeMap<>();
    for (AnomalyWindow window : group) {
      start = Math.min(start, window.start());
      end = Math.max(end, window.end());
      severity = Severity.max(severity, window.severity());
      methods.addAll(window.detectors());
      MetricContribution contribution = new MetricContribution(window.metric(), window.deltaPct(), window.severity());
      byMetric.merge(window.metric(), contribution,
        (a, b) -> Math.abs(a.deltaPct()) >= Math.abs(b.deltaPct()) ? a : b);
    }
    List<MetricContribution> metrics = new ArrayList<>(byMetric.values());
    metrics.sort(STRONGEST_FIRST);
    Direction direction = metrics.get(0).deltaPct() >= 0 ? Direction.INCREASE : Direction.DECREASE;
    String scope = group.get(0).scope();
    return new MergedEvent(scope, start, end, metrics, volume, severity, 0.0, methods, direction, List.of());
  }
}
