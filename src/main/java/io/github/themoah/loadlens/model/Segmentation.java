package io.github.themoah.loadlens.model;

/**
 * Split of the overall timeline into ramp-up and fixed load.
 *
 * @param splitIndex first sample index of the fixed-load phase
 * @param splitTimestamp epoch millis of that sample
 * @param tippingPointFound whether a correlation tipping point was confirmed
 * @param stableFraction fraction of samples where the base metric is stable
 * @param fixedLoad whether the test qualifies as a fixed-load test
 * @param saturation saturation finding when load was still rising at the tipping point, else {@code null}
 */
public record Segmentation(
  int splitIndex,
  long splitTimestamp,
  boolean tippingPointFound,
  double stableFraction,
  boolean fixedLoad,
  SaturationPoint saturation
) {

  /**
   * Load level at which throughput stopped following the base metric.
   *
   * @param timestamp epoch millis of the tipping point
   * @param throughput throughput at the tipping point
   * @param load base metric value at the tipping point
   */
  public record SaturationPoint(long timestamp, double throughput, double load) {}
}
