package io.github.themoah.loadlens.analysis.window;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.analysis.detector.DetectionResult;
import io.github.themoah.loadlens.analysis.scoring.SeverityMapper;
import io.github.themoah.loadlens.config.WindowSettings;
import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.Direction;
import io.github.themoah.loadlens.model.MetricKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns per-sample flags into time-bounded windows with an effect size.
 *
 * <p>Runs of flags separated by at most {@code merge_gap_samples} normal samples
 * form one window ending at its last flagged sample. The effect size compares
 * the window mean against the median of the samples before it.
 */
public class WindowExtractor {

  private static final Logger log = LoggerFactory.getLogger(WindowExtractor.class);

  private final WindowSettings settings;
  private final SeverityMapper severityMapper;

  public WindowExtractor(WindowSettings settings, SeverityMapper severityMapper) {
    this.settings = settings;
    this.severityMapper = severityMapper;
  }

  public List<AnomalyWindow> extract(
      String scope,
      String metric,
      DetectionResult detection,
      double[] values,
      long[] timestamps
  ) {
    List<AnomalyWindow> windows = new ArrayList<>();
    double minDelta = settings.minDeltaPct(MetricKind.of(metric));
    int n = Math.min(values.length, timestamps.length);
    int i = 0;
    while (i < n) {
      if (!detection.isFlagged(i)) {
        i++;
        continue;
      }
      int start = i;
      int lastFlagged = i;
      Set<String> detectors = new TreeSet<>(detection.detectorsAt(i));
      int j = i + 1;
      while (j < n && j - lastFlagged - 1 <= settings.mergeGapSamples()) {
        if (detection.isFlagged(j)) {
          lastFlagged = j;
          detectors.addAll(detection.detectorsAt(j));
        }
        j++;
      }
      i = lastFlagged + 1;

      int end = lastFlagged;
      if (start == end) {
        if (end + 1 < n) {
          end++;
        } else if (start > 0) {
          start--;
        }
      }
      AnomalyWindow window = build(scope, metric, start, end, values, timestamps, detectors);
      if (window == null) {
        continue;
      }
      if (Math.abs(window.deltaPct()) < minDelta) {
        log.debug("Dropping {}/{} window [{}..{}]: |delta|={} below {}",
          scope, metric, start, end, String.format("%.1f", Math.abs(window.deltaPct())), minDelta);
        continue;
      }
      windows.add(window);
    }
    return windows;
  }

  private AnomalyWindow build(
      String scope,
      String metric,
      int start,
      int end,
      double[] values,
      long[] timestamps,
      Set<String> detectors
  ) {
    double mean = StatisticalUtils.mean(values, start, end + 1);
    if (Double.isNaN(mean)) {
      return null;
    }
    double baseline = baseline(values, start, end);
    double deltaPct = deltaPct(mean, baseline);
    Direction direction = deltaPct >= 0 ? Direction.INCREASE : Direction.DECREASE;
    double peak = peak(values, start, end, direction);
    return new AnomalyWindow(scope, metric, start, end, timestamps[start], timestamps[end],
      deltaPct, severityMapper.map(deltaPct), detectors, direction, baseline, peak);
  }

  /**
   * Median of the samples before the window, else the samples after it, else the
   * window's first finite value.
   */
  double baseline(double[] values, int start, int end) {
    int size = settings.baselineWindow();
    double before = StatisticalUtils.median(values, start - size, start);
    if (!Double.isNaN(before)) {
      return before;
    }
    double after = StatisticalUtils.median(values, end + 1, end + 1 + size);
    if (!Double.isNaN(after)) {
      return after;
    }
    for (int k = start; k <= end; k++) {
      if (!Double.isNaN(values[k])) {
        return values[k];
      }
    }
    return Double.NaN;
  }

  static double deltaPct(double mean, double baseline) {
    if (Double.isNaN(baseline)) {
      return 0.0;
    }
    if (Math.abs(baseline) < StatisticalUtils.EPSILON) {
      if (mean > StatisticalUtils.EPSILON) {
        return 100.0;
      }
      return mean < -StatisticalUtils.EPSILON ? -100.0 : 0.0;
    }
    return (mean - baseline) / Math.abs(baseline) * 100.0;
  }

  private static double peak(double[] values, int start, int end, Direction direction) {
    double peak = Double.NaN;
    for (int k = start; k <= end; k++) {
      double value = values[k];
      if (Double.isNaN(value)) {
        continue;
      }
      if (Double.isNaN(peak)
          || (direction == Direction.INCREASE && value > peak)
          || (direction == Direction.DECREASE && value < peak)) {
        peak = value;
      }
    }
    return peak;
  }
}
