package io.github.themoah.loadlens.analysis.scoring;

import io.github.themoah.loadlens.config.ScoringSettings;
import io.github.themoah.loadlens.model.MergedEvent;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders events from all scopes into one ranking.
 *
 * <p>Highest impact first; ties go to the earlier start, then scope name, then
 * the name of the first contributing metric. Events below {@code min_impact}
 * are dropped.
 */
public class EventRanker {

  private static final Logger log = LoggerFactory.getLogger(EventRanker.class);

  static final Comparator<MergedEvent> RANKING = Comparator
    .comparingDouble(MergedEvent::impact).reversed()
    .thenComparingLong(MergedEvent::start)
    .thenComparing(MergedEvent::scope)
    .thenComparing(event -> event.metrics().get(0).name());

  private final ScoringSettings settings;

  public EventRanker(ScoringSettings settings) {
    this.settings = settings;
  }

  public List<MergedEvent> rank(List<MergedEvent> events) {
    List<MergedEvent> ranked = events.stream()
      .filter(event -> event.impact() >= settings.minImpact())
      .sorted(RANKING)
      .collect(Collectors.toList());
    if (ranked.size() < events.size()) {
      log.debug("Dropped {} events below min_impact {}", events.size() - ranked.size(), settings.minImpact());
    }
    return ranked;
  }
}
