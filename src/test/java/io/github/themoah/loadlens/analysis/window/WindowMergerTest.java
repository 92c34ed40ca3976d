package io.github.themoah.loadlens.analysis.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.Direction;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricContribution;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Severity;
import io.github.themoah.loadlens.model.TrafficVolume;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WindowMerger.
 */
public class WindowMergerTest {

  private static final long SECOND = 1000L;
  private static final TrafficVolume VOLUME = TrafficVolume.overall(120.0);

  private static AnomalyWindow window(String metric, long startSec, long endSec, double deltaPct, Severity severity) {
    Direction direction = deltaPct >= 0 ? Direction.INCREASE : Direction.DECREASE;
    return new AnomalyWindow(ScopeFrame.OVERALL, metric, (int) startSec, (int) endSec,
      startSec * SECOND, endSec * SECOND, deltaPct, severity, Set.of(metric + "-detector"), direction, 100.0, 100.0);
  }

  @Test
  void overlappingWindows_mergedWithBothMetrics() {
    List<MergedEvent> events = new WindowMerger(0).merge(List.of(
      window("rt_avg", 0, 10, 80.0, Severity.CRITICAL),
      window("error_rate", 8, 20, 30.0, Severity.MEDIUM)
    ), SECOND, VOLUME);

    assertEquals(1, events.size());
    MergedEvent event = events.get(0);
    assertEquals(0L, event.start());
    assertEquals(20 * SECOND, event.end());
    assertEquals(List.of("rt_avg", "error_rate"), event.metrics().stream().map(MetricContribution::name).toList());
    assertEquals(Severity.CRITICAL, event.severity());
    assertEquals(Set.of("rt_avg-detector", "error_rate-detector"), event.methods());
    assertEquals(0.0, event.impact());
    assertEquals(VOLUME, event.volume());
  }

  @Test
  void chainedOverlaps_mergedTransitively() {
    List<MergedEvent> events = new WindowMerger(0).merge(List.of(
      window("c", 18, 30, 20.0, Severity.LOW),
      window("a", 0, 10, 20.0, Severity.LOW),
      window("b", 10, 20, 20.0, Severity.LOW)
    ), SECOND, VOLUME);

    assertEquals(1, events.size());
    assertEquals(30 * SECOND, events.get(0).end());
  }

  @Test
  void gapTolerance_scaledBySampleInterval() {
    WindowMerger merger = new WindowMerger(4);

    List<MergedEvent> bridged = merger.merge(List.of(
      window("rt_avg", 0, 10, 50.0, Severity.HIGH),
      window("rt_p90", 14, 20, 50.0, Severity.HIGH)
    ), SECOND, VOLUME);
    List<MergedEvent> separate = merger.merge(List.of(
      window("rt_avg", 0, 10, 50.0, Severity.HIGH),
      window("rt_p90", 15, 20, 50.0, Severity.HIGH)
    ), SECOND, VOLUME);

    assertEquals(1, bridged.size());
    assertEquals(2, separate.size());
    assertTrue(separate.get(0).start() < separate.get(1).start());
  }

  @Test
  void sameMetricTwice_keepsStrongestContribution() {
    MergedEvent event = new WindowMerger(0).merge(List.of(
      window("rt_avg", 0, 10, 30.0, Severity.MEDIUM),
      window("rt_avg", 5, 12, -70.0, Severity.CRITICAL)
    ), SECOND, VOLUME).get(0);

    assertEquals(1, event.metrics().size());
    assertEquals(-70.0, event.metrics().get(0).deltaPct());
    assertEquals(Direction.DECREASE, event.direction());
  }

  @Test
  void direction_followsStrongestMetric() {
    MergedEvent event = new WindowMerger(0).merge(List.of(
      window("throughput", 0, 10, -15.0, Severity.LOW),
      window("rt_avg", 0, 10, 90.0, Severity.CRITICAL)
    ), SECOND, VOLUME).get(0);

    assertEquals(Direction.INCREASE, event.direction());
    assertEquals("rt_avg", event.metrics().get(0).name());
  }

  @Test
  void noWindows_noEvents() {
    assertTrue(new WindowMerger(4).merge(List.of(), SECOND, VOLUME).isEmpty());
  }
}
