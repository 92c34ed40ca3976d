package io.github.themoah.loadlens.analysis.scoring;

import io.github.themoah.loadlens.model.MergedEvent;

/**
 * Computes {@code impact = severity_score × volume_share × ln(1 + duration_sec)}.
 */
public final class ImpactScorer {

  private ImpactScorer() {}

  public static double impact(MergedEvent event) {
    double share = event.volume() == null ? 0.0 : event.volume().share();
    if (Double.isNaN(share) || share < 0) {
      share = 0.0;
    }
    double duration = Math.max(0.0, event.durationSec());
    return event.severity().score() * share * Math.log1p(duration);
  }

  public static MergedEvent score(MergedEvent event) {
    return event.withImpact(impact(event));
  }
}
