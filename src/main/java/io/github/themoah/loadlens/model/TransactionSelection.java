package io.github.themoah.loadlens.model;

import java.util.List;

/**
 * Outcome of transaction selection.
 *
 * @param selected retained candidates, highest share first
 * @param totalTransactions number of transactions offered
 * @param eligibleTransactions number passing the traffic floor
 * @param cumulativeShare summed share of the selected candidates
 */
public record TransactionSelection(
  List<TransactionCandidate> selected,
  int totalTransactions,
  int eligibleTransactions,
  double cumulativeShare
) {

  public TransactionSelection {
    selected = List.copyOf(selected);
  }

  public static TransactionSelection empty() {
    return new TransactionSelection(List.of(), 0, 0, 0.0);
  }
}
