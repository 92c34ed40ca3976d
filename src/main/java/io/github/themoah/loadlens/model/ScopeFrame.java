package io.github.themoah.loadlens.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Time-aligned samples of one scope: a sorted timestamp axis and one value
 * array per metric. Missing readings are {@code NaN}.
 *
 * <p>Instances are immutable; arrays are copied in and out.
 */
public final class ScopeFrame {

  public static final String OVERALL = "overall";

  private final String scope;
  private final long[] timestamps;
  private final Map<String, double[]> metrics;

  public ScopeFrame(String scope, long[] timestamps, Map<String, double[]> metrics) {
    this.scope = scope;
    this.timestamps = timestamps.clone();
    Map<String, double[]> copy = new TreeMap<>();
    for (Map.Entry<String, double[]> entry : metrics.entrySet()) {
      if (entry.getValue().length != timestamps.length) {
        throw new IllegalArgumentException("Metric " + entry.getKey() + " in scope " + scope
          + " has " + entry.getValue().length + " values for " + timestamps.length + " timestamps");
      }
      copy.put(entry.getKey(), entry.getValue().clone());
    }
    this.metrics = Collections.unmodifiableMap(copy);
  }

  public String scope() {
    return scope;
  }

  public boolean isOverall() {
    return OVERALL.equals(scope);
  }

  public int size() {
    return timestamps.length;
  }

  public boolean isEmpty() {
    return timestamps.length == 0 || metrics.isEmpty();
  }

  public long[] timestamps() {
    return timestamps.clone();
  }

  public long timestampAt(int index) {
    return timestamps[index];
  }

  public Set<String> metricNames() {
    return metrics.keySet();
  }

  public boolean hasMetric(String metric) {
    return metrics.containsKey(metric);
  }

  /**
   * Returns a copy of the metric's values, or {@code null} if the metric is absent.
   */
  public double[] values(String metric) {
    double[] values = metrics.get(metric);
    return values == null ? null : values.clone();
  }

  /**
   * Returns the sub-frame {@code [from, size)}.
   */
  public ScopeFrame sliceFrom(int from) {
    int start = Math.max(0, Math.min(from, timestamps.length));
    Map<String, double[]> sliced = new TreeMap<>();
    metrics.forEach((name, values) -> sliced.put(name, Arrays.copyOfRange(values, start, values.length)));
    return new ScopeFrame(scope, Arrays.copyOfRange(timestamps, start, timestamps.length), sliced);
  }

  /**
   * Returns the sub-frame with timestamps at or after {@code timestamp}.
   */
  public ScopeFrame sliceFromTimestamp(long timestamp) {
    int index = 0;
    while (index < timestamps.length && timestamps[index] < timestamp) {
      index++;
    }
    return sliceFrom(index);
  }

  /**
   * Aligns an external series onto this frame's timestamps; unmatched positions are {@code NaN}.
   */
  public double[] align(long[] otherTimestamps, double[] otherValues) {
    double[] aligned = new double[timestamps.length];
    Arrays.fill(aligned, Double.NaN);
    int j = 0;
    for (int i = 0; i < timestamps.length; i++) {
      while (j < otherTimestamps.length && otherTimestamps[j] < timestamps[i]) {
        j++;
      }
      if (j < otherTimestamps.length && otherTimestamps[j] == timestamps[i]) {
        aligned[i] = otherValues[j];
      }
    }
    return aligned;
  }

  @Override
  public String toString() {
    return "ScopeFrame{scope=" + scope + ", samples=" + timestamps.length + ", metrics=" + metrics.keySet() + "}";
  }
}
