package io.github.themoah.loadlens.model;

/**
 * Per-transaction traffic figures computed from fixed-load samples.
 *
 * @param name the transaction name
 * @param meanRps mean requests per second
 * @param volumeShare mean RPS divided by the overall mean throughput
 * @param sampleCount number of samples in the fixed-load phase
 */
public record TransactionCandidate(
  String name,
  double meanRps,
  double volumeShare,
  int sampleCount
) {}
