package io.github.themoah.loadlens.analysis;

import io.github.themoah.loadlens.model.AnalysisInput;
import io.github.themoah.loadlens.model.Sample;
import io.github.themoah.loadlens.model.ScopeFrame;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds time-aligned {@link ScopeFrame}s from flat sample lists.
 */
public final class SampleFrames {

  private static final Logger log = LoggerFactory.getLogger(SampleFrames.class);

  private SampleFrames() {}

  /**
   * Groups samples by scope and aligns each scope's metrics on the union of its timestamps.
   * When the same (scope, metric, timestamp) occurs twice, the later sample wins.
   *
   * @param samples samples in any order
   * @return the overall frame (or {@code null} when no overall sample exists) and
   *     one frame per transaction, ordered by name
   */
  public static AnalysisInput fromSamples(Collection<Sample> samples) {
    Map<String, Map<String, TreeMap<Long, Double>>> byScope = new TreeMap<>();
    int skipped = 0;
    for (Sample sample : samples) {
      if (sample == null || sample.scope() == null || sample.metric() == null) {
        skipped++;
        continue;
      }
      byScope
        .computeIfAbsent(sample.scope(), s -> new TreeMap<>())
        .computeIfAbsent(sample.metric(), m -> new TreeMap<>())
        .put(sample.timestamp(), sample.value());
    }
    if (skipped > 0) {
      log.debug("Skipped {} samples without scope or metric", skipped);
    }

    ScopeFrame overall = null;
    List<ScopeFrame> transactions = new ArrayList<>();
    for (Map.Entry<String, Map<String, TreeMap<Long, Double>>> entry : byScope.entrySet()) {
      ScopeFrame frame = toFrame(entry.getKey(), entry.getValue());
      if (frame.isOverall()) {
        overall = frame;
      } else {
        transactions.add(frame);
      }
    }
    log.debug("Built frames: overall={}, transactions={}", overall, transactions.size());
    return new AnalysisInput(overall, transactions);
  }

  private static ScopeFrame toFrame(String scope, Map<String, TreeMap<Long, Double>> metrics) {
    TreeSet<Long> axis = new TreeSet<>();
    metrics.values().forEach(series -> axis.addAll(series.keySet()));
    long[] timestamps = axis.stream().mapToLong(Long::longValue).toArray();

    Map<String, double[]> columns = new TreeMap<>();
    for (Map.Entry<String, TreeMap<Long, Double>> metric : metrics.entrySet()) {
      double[] values = new double[timestamps.length];
      Arrays.fill(values, Double.NaN);
      for (int i = 0; i < timestamps.length; i++) {
        Double value = metric.getValue().get(timestamps[i]);
        if (value != null && Double.isFinite(value)) {
          values[i] = value;
        }
      }
      columns.put(metric.getKey(), values);
    }
    return new ScopeFrame(scope, timestamps, columns);
  }
}
