package io.github.themoah.loadlens.analysis.scoring;

import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.TransactionContribution;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Links each overall event to the transaction events that overlap it in time.
 */
public final class TransactionAttributor {

  private static final Comparator<TransactionContribution> BY_SHARE = Comparator
    .comparingDouble(TransactionContribution::share).reversed()
    .thenComparing(TransactionContribution::transaction);

  private TransactionAttributor() {}

  /**
   * Returns the overall events with their contributors set, in the same order.
   * A transaction appears at most once per overall event, with its longest overlap.
   */
  public static List<MergedEvent> attribute(List<MergedEvent> overallEvents, List<MergedEvent> transactionEvents) {
    List<MergedEvent> attributed = new ArrayList<>(overallEvents.size());
    for (MergedEvent overall : overallEvents) {
      Map<String, TransactionContribution> byTransaction = new TreeMap<>();
      for (MergedEvent txn : transactionEvents) {
        if (txn.start() > overall.end() || txn.end() < overall.start()) {
          continue;
        }
        double overlapSec = (Math.min(txn.end(), overall.end()) - Math.max(txn.start(), overall.start())) / 1000.0;
        TransactionContribution contribution = new TransactionContribution(
          txn.scope(), txn.volume().share(), txn.direction(), overlapSec);
        byTransaction.merge(txn.scope(), contribution,
          (a, b) -> a.overlapSec() >= b.overlapSec() ? a : b);
      }
      List<TransactionContribution> contributors = new ArrayList<>(byTransaction.values());
      contributors.sort(BY_SHARE);
      attributed.add(overall.withContributors(contributors));
    }
    return attributed;
  }
}
