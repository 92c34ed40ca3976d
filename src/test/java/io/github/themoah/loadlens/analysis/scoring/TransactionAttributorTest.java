package io.github.themoah.loadlens.analysis.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.model.Direction;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricContribution;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Severity;
import io.github.themoah.loadlens.model.TrafficVolume;
import io.github.themoah.loadlens.model.TransactionContribution;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TransactionAttributor.
 */
public class TransactionAttributorTest {

  private static MergedEvent event(String scope, long startSec, long endSec, double share, Direction direction) {
    return new MergedEvent(scope, startSec * 1000L, endSec * 1000L,
      List.of(new MetricContribution("rt_avg", 40.0, Severity.HIGH)),
      new TrafficVolume(10.0, share), Severity.HIGH, 0.0, Set.of("zscore"), direction, List.of());
  }

  @Test
  void overlappingTransactions_attributedByShare() {
    MergedEvent overall = event(ScopeFrame.OVERALL, 0, 60, 1.0, Direction.INCREASE);
    List<MergedEvent> txns = List.of(
      event("login", 10, 20, 0.3, Direction.INCREASE),
      event("login", 30, 50, 0.3, Direction.INCREASE),
      event("checkout", 55, 70, 0.6, Direction.DECREASE),
      event("search", 70, 80, 0.1, Direction.INCREASE));

    List<TransactionContribution> contributors =
      TransactionAttributor.attribute(List.of(overall), txns).get(0).contributors();

    assertEquals(2, contributors.size());
    assertEquals("checkout", contributors.get(0).transaction());
    assertEquals(5.0, contributors.get(0).overlapSec(), 1e-9);
    assertEquals(Direction.DECREASE, contributors.get(0).direction());
    assertEquals("login", contributors.get(1).transaction());
    assertEquals(20.0, contributors.get(1).overlapSec(), 1e-9);
  }

  @Test
  void noOverlap_noContributors() {
    MergedEvent overall = event(ScopeFrame.OVERALL, 0, 10, 1.0, Direction.INCREASE);

    List<MergedEvent> attributed = TransactionAttributor.attribute(List.of(overall),
      List.of(event("login", 20, 30, 0.5, Direction.INCREASE)));

    assertTrue(attributed.get(0).contributors().isEmpty());
  }

  @Test
  void orderOfOverallEvents_preserved() {
    MergedEvent first = event(ScopeFrame.OVERALL, 100, 200, 1.0, Direction.INCREASE);
    MergedEvent second = event(ScopeFrame.OVERALL, 0, 50, 1.0, Direction.INCREASE);

    List<MergedEvent> attributed = TransactionAttributor.attribute(List.of(first, second), List.of());

    assertEquals(100_000L, attributed.get(0).start());
    assertEquals(0L, attributed.get(1).start());
  }
}
