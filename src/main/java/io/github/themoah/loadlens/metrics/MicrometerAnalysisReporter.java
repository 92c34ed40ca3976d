package io.github.themoah.loadlens.metrics;

import io.github.themoah.loadlens.model.AnalysisResult;
import io.github.themoah.loadlens.model.MergedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports analysis runs using a Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, OTLP, Datadog).
 */
public class MicrometerAnalysisReporter implements AnalysisReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerAnalysisReporter.class);

  static final String RUNS = "loadlens.analysis.runs";
  static final String DURATION = "loadlens.analysis.duration";
  static final String EVENTS = "loadlens.analysis.events";
  static final String TRANSACTIONS_SELECTED = "loadlens.analysis.transactions.selected";
  static final String STATUS_FAILED = "failed";

  private final MeterRegistry registry;
  private final Timer duration;
  private final DistributionSummary transactionsSelected;

  public MicrometerAnalysisReporter(MeterRegistry registry) {
    this.registry = registry;
    this.duration = Timer.builder(DURATION)
      .description("Wall time of analysis runs")
      .register(registry);
    this.transactionsSelected = DistributionSummary.builder(TRANSACTIONS_SELECTED)
      .description("Transactions analyzed per run")
      .register(registry);
  }

  @Override
  public void recordRun(AnalysisResult result, Duration elapsed) {
    duration.record(elapsed);
    runs(result.status().label()).increment();
    for (MergedEvent event : result.events()) {
      Counter.builder(EVENTS)
        .description("Ranked anomaly events")
        .tag("severity", event.severity().label())
        .register(registry)
        .increment();
    }
    if (!result.isInsufficientData()) {
      transactionsSelected.record(result.transactionSelection().selected().size());
    }
    log.debug("Recorded analysis run: status={}, events={}, elapsed={}ms",
      result.status().label(), result.events().size(), elapsed.toMillis());
  }

  @Override
  public void recordFailure(Duration elapsed) {
    duration.record(elapsed);
    runs(STATUS_FAILED).increment();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerAnalysisReporter");
    registry.close();
    return Future.succeededFuture();
  }

  private Counter runs(String status) {
    return Counter.builder(RUNS)
      .description("Analysis runs by outcome")
      .tag("status", status)
      .register(registry);
  }
}
