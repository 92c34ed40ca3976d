package io.github.themoah.loadlens.model;

/**
 * A single telemetry reading for one metric within one scope.
 *
 * @param timestamp epoch milliseconds
 * @param metric the metric name (see {@link MetricNames})
 * @param value the observed value
 * @param scope {@link ScopeFrame#OVERALL} or a transaction name
 */
public record Sample(
  long timestamp,
  String metric,
  double value,
  String scope
) {}
