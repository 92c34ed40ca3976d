package io.github.themoah.loadlens.model;

/**
 * Traffic carried by the scope of an event.
 *
 * @param meanRps mean requests per second
 * @param share fraction of overall traffic (1.0 for the overall scope)
 */
public record TrafficVolume(
  double meanRps,
  double share
) {

  public static TrafficVolume overall(double meanRps) {
    return new TrafficVolume(meanRps, 1.0);
  }
}
