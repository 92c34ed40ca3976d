package io.github.themoah.loadlens.service;

import io.github.themoah.loadlens.analysis.AnomalyAnalysisEngine;
import io.github.themoah.loadlens.analysis.SampleFrames;
import io.github.themoah.loadlens.config.AnalysisSettings;
import io.github.themoah.loadlens.metrics.AnalysisReporter;
import io.github.themoah.loadlens.model.AnalysisInput;
import io.github.themoah.loadlens.model.AnalysisResult;
import io.github.themoah.loadlens.report.EventAssembler;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs analyses off the event loop.
 *
 * <p>Each request gets its own settings and engine, so concurrent requests for
 * different tests share no analysis state.
 */
public class AnalysisService {

  private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

  private final Vertx vertx;
  private final AnalysisReporter reporter;

  public AnalysisService(Vertx vertx, AnalysisReporter reporter) {
    this.vertx = vertx;
    this.reporter = reporter;
  }

  /**
   * Decodes the request and analyzes it on a worker thread.
   *
   * @param request the JSON request
   * @return the full result document, or a failed future carrying an
   *     {@link AnalysisRequestException} when the request is malformed
   */
  public Future<JsonObject> analyze(JsonObject request) {
    AnalysisRequest decoded;
    try {
      decoded = AnalysisRequestCodec.decode(request);
    } catch (AnalysisRequestException e) {
      log.warn("Rejected analysis request: {}", e.getMessage());
      return Future.failedFuture(e);
    }
    return vertx.executeBlocking(() -> EventAssembler.toJson(run(decoded)), false);
  }

  /**
   * Runs the engine synchronously and records the outcome.
   */
  public AnalysisResult run(AnalysisRequest request) {
    long startNanos = System.nanoTime();
    try {
      AnalysisSettings settings = AnalysisSettings.fromMap(request.settings());
      AnalysisInput input = SampleFrames.fromSamples(request.samples());
      AnalysisResult result = new AnomalyAnalysisEngine(settings).analyze(input);
      reporter.recordRun(result, Duration.ofNanos(System.nanoTime() - startNanos));
      return result;
    } catch (RuntimeException e) {
      reporter.recordFailure(Duration.ofNanos(System.nanoTime() - startNanos));
      throw e;
    }
  }
}
