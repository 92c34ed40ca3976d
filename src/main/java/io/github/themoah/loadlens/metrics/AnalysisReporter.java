package io.github.themoah.loadlens.metrics;

import io.github.themoah.loadlens.model.AnalysisResult;
import io.vertx.core.Future;
import java.time.Duration;

/**
 * Interface for reporting analysis runs to external systems.
 */
public interface AnalysisReporter {

  /**
   * Reporter used when metrics are disabled.
   */
  AnalysisReporter NOOP = new AnalysisReporter() {
    @Override
    public void recordRun(AnalysisResult result, Duration elapsed) {
    }

    @Override
    public void recordFailure(Duration elapsed) {
    }
  };

  /**
   * Records a completed run.
   *
   * @param result the result of the run
   * @param elapsed wall time of the run
   */
  void recordRun(AnalysisResult result, Duration elapsed);

  /**
   * Records a run that threw.
   *
   * @param elapsed wall time until the failure
   */
  void recordFailure(Duration elapsed);

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
