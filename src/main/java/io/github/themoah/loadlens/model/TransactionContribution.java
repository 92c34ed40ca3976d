package io.github.themoah.loadlens.model;

/**
 * A transaction event overlapping an overall event.
 *
 * @param transaction the transaction name
 * @param share the transaction's traffic share
 * @param direction direction of the transaction's dominant metric
 * @param overlapSec seconds of overlap with the overall event
 */
public record TransactionContribution(
  String transaction,
  double share,
  Direction direction,
  double overlapSec
) {}
