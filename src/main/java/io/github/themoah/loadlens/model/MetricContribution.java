package io.github.themoah.loadlens.model;

/**
 * One metric's contribution to a merged event.
 */
public record MetricContribution(
  String name,
  double deltaPct,
  Severity severity
) {}
