package io.github.themoah.loadlens.model;

import java.util.List;

/**
 * Immutable snapshot of one completed test: the overall frame and one frame per transaction.
 *
 * @param overall the overall frame, may be {@code null} when nothing was loaded
 * @param transactions per-transaction frames
 */
public record AnalysisInput(
  ScopeFrame overall,
  List<ScopeFrame> transactions
) {

  public AnalysisInput {
    transactions = transactions == null ? List.of() : List.copyOf(transactions);
  }

  public boolean hasOverallData() {
    return overall != null && !overall.isEmpty();
  }
}
