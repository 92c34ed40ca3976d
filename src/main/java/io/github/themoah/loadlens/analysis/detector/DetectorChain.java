package io.github.themoah.loadlens.analysis.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every applicable detector on one metric and ORs their flags.
 *
 * <p>A detector that throws is skipped for that metric and scope; the others
 * still contribute.
 */
public class DetectorChain {

  private static final Logger log = LoggerFactory.getLogger(DetectorChain.class);

  private final List<MetricDetector> detectors;

  public DetectorChain(List<MetricDetector> detectors) {
    this.detectors = List.copyOf(detectors);
  }

  /**
   * The built-in detectors: z-score, isolation forest and stability/trend.
   */
  public static DetectorChain standard() {
    return new DetectorChain(List.of(
      new ZScoreDetector(),
      new IsolationForestDetector(),
      new StabilityTrendDetector()
    ));
  }

  public List<MetricDetector> detectors() {
    return detectors;
  }

  public DetectionResult run(double[] series, DetectionContext context) {
    boolean[] combined = new boolean[series.length];
    List<Set<String>> provenance = new ArrayList<>(series.length);
    for (int i = 0; i < series.length; i++) {
      provenance.add(new TreeSet<>());
    }
    ContextualMedianFilter contextFilter = context.settings().contextMedianEnabled()
      ? new ContextualMedianFilter(context.settings().contextMedianWindow(), context.settings().contextMedianPct())
      : null;

    for (MetricDetector detector : detectors) {
      if (!detector.appliesTo(context)) {
        continue;
      }
      boolean[] flags;
      try {
        flags = detector.detect(series, context);
        if (flags.length != series.length) {
          throw new IllegalStateException("Detector returned " + flags.length + " flags for "
            + series.length + " samples");
        }
      } catch (RuntimeException e) {
        log.warn("Detector {} failed on {}/{}, skipping: {}",
          detector.name(), context.scope(), context.metric(), e.getMessage(), e);
        continue;
      }
      if (contextFilter != null && detector.contextFiltered()) {
        flags = contextFilter.filter(flags, series);
      }
      int flagged = 0;
      for (int i = 0; i < flags.length; i++) {
        if (flags[i]) {
          combined[i] = true;
          provenance.get(i).add(detector.name());
          flagged++;
        }
      }
      log.debug("Detector {} flagged {} samples of {}/{}", detector.name(), flagged, context.scope(), context.metric());
    }
    return new DetectionResult(combined, provenance);
  }
}
