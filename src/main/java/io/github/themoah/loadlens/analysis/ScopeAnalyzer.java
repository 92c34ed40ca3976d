package io.github.themoah.loadlens.analysis;

import io.github.themoah.loadlens.analysis.detector.DetectionContext;
import io.github.themoah.loadlens.analysis.detector.DetectionResult;
import io.github.themoah.loadlens.analysis.detector.DetectorChain;
import io.github.themoah.loadlens.analysis.window.WindowExtractor;
import io.github.themoah.loadlens.analysis.window.WindowMerger;
import io.github.themoah.loadlens.config.DetectorSettings;
import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.TrafficVolume;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs detection, window extraction and merging for one scope.
 *
 * <p>Failures are contained per metric: a metric that cannot be analyzed is
 * logged and skipped, and never aborts the scope.
 */
class ScopeAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ScopeAnalyzer.class);

  private final DetectorChain detectorChain;
  private final WindowExtractor windowExtractor;
  private final WindowMerger windowMerger;

  ScopeAnalyzer(DetectorChain detectorChain, WindowExtractor windowExtractor, WindowMerger windowMerger) {
    this.detectorChain = detectorChain;
    this.windowExtractor = windowExtractor;
    this.windowMerger = windowMerger;
  }

  ScopeOutcome analyze(
      ScopeFrame frame,
      List<String> metrics,
      AnalysisMode mode,
      DetectorSettings detectorSettings,
      TrafficVolume volume
  ) {
    Map<String, List<AnomalyWindow>> windowsByMetric = new TreeMap<>();
    List<AnomalyWindow> allWindows = new ArrayList<>();
    long[] timestamps = frame.timestamps();

    for (String metric : metrics) {
      double[] values = frame.values(metric);
      if (values == null || StatisticalUtils.countFinite(values, 0, values.length) == 0) {
        log.debug("Skipping {}/{}: no data", frame.scope(), metric);
        continue;
      }
      try {
        DetectionContext context = new DetectionContext(frame, metric, mode, detectorSettings);
        DetectionResult detection = detectorChain.run(values, context);
        if (!detection.anyFlagged()) {
          continue;
        }
        List<AnomalyWindow> windows = windowExtractor.extract(frame.scope(), metric, detection, values, timestamps);
        if (!windows.isEmpty()) {
          windowsByMetric.put(metric, windows);
          allWindows.addAll(windows);
          log.debug("{}/{}: {} flagged samples, {} windows",
            frame.scope(), metric, detection.flaggedCount(), windows.size());
        }
      } catch (RuntimeException e) {
        log.warn("Analysis of {}/{} failed, skipping metric: {}", frame.scope(), metric, e.getMessage(), e);
      }
    }

    List<MergedEvent> events = windowMerger.merge(allWindows, StatisticalUtils.medianInterval(timestamps), volume);
    return new ScopeOutcome(windowsByMetric, events);
  }

  record ScopeOutcome(Map<String, List<AnomalyWindow>> windowsByMetric, List<MergedEvent> events) {}
}
