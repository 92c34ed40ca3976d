package io.github.themoah.loadlens.analysis.transaction;

import static io.github.themoah.loadlens.analysis.FrameFixtures.constant;
import static io.github.themoah.loadlens.analysis.FrameFixtures.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.loadlens.config.TransactionSettings;
import io.github.themoah.loadlens.config.TransactionSettings.SelectionPolicy;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.TransactionCandidate;
import io.github.themoah.loadlens.model.TransactionSelection;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TransactionSelector.
 */
public class TransactionSelectorTest {

  private static TransactionSettings settings(SelectionPolicy policy, double coverage, int maxK) {
    return new TransactionSettings(true, false, policy, coverage, maxK, 6, 0.1, List.of("rps"));
  }

  private static ScopeFrame txn(String name, double rps) {
    return frame(name, "rps", constant(20, rps));
  }

  private static List<String> names(TransactionSelection selection) {
    return selection.selected().stream().map(TransactionCandidate::name).toList();
  }

  @Test
  void coverage_keepsSmallestPrefixReachingTarget() {
    List<ScopeFrame> frames = List.of(txn("search", 5), txn("login", 60), txn("cart", 5), txn("checkout", 30));

    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.COVERAGE, 0.8, 50))
      .select(frames, 100.0);

    assertEquals(List.of("login", "checkout"), names(selection));
    assertEquals(4, selection.totalTransactions());
    assertEquals(4, selection.eligibleTransactions());
    assertEquals(0.9, selection.cumulativeShare(), 1e-9);
  }

  @Test
  void coverage_cappedAtMaxK() {
    List<ScopeFrame> frames = List.of(txn("a", 10), txn("b", 10), txn("c", 10));

    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.COVERAGE, 1.0, 2))
      .select(frames, 100.0);

    assertEquals(2, selection.selected().size());
  }

  @Test
  void topK_keepsHighestShares() {
    List<ScopeFrame> frames = List.of(txn("a", 10), txn("b", 40), txn("c", 20), txn("d", 30));

    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.TOP_K, 0.8, 3))
      .select(frames, 100.0);

    assertEquals(List.of("b", "d", "c"), names(selection));
  }

  @Test
  void belowFloor_neverSelected() {
    List<ScopeFrame> frames = List.of(
      txn("busy", 50),
      txn("idle", 0.05),
      frame("short", "rps", constant(3, 40)));

    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.TOP_K, 0.8, 50))
      .select(frames, 100.0);

    assertEquals(List.of("busy"), names(selection));
    assertEquals(3, selection.totalTransactions());
    assertEquals(1, selection.eligibleTransactions());
  }

  @Test
  void equalShares_orderedByName() {
    List<ScopeFrame> frames = List.of(txn("zeta", 10), txn("alpha", 10), txn("mid", 10));

    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.TOP_K, 0.8, 50))
      .select(frames, 100.0);

    assertEquals(List.of("alpha", "mid", "zeta"), names(selection));
  }

  @Test
  void zeroOverallThroughput_zeroShares() {
    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.TOP_K, 0.8, 50))
      .select(List.of(txn("login", 10)), 0.0);

    assertEquals(0.0, selection.selected().get(0).volumeShare());
    assertEquals(10.0, selection.selected().get(0).meanRps(), 1e-9);
  }

  @Test
  void missingRps_skipped() {
    TransactionSelection selection = new TransactionSelector(settings(SelectionPolicy.TOP_K, 0.8, 50))
      .select(List.of(frame("login", "rt_ms_avg", constant(20, 100))), 100.0);

    assertEquals(0, selection.selected().size());
    assertEquals(1, selection.totalTransactions());
  }
}
