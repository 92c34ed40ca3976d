package io.github.themoah.loadlens.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.metrics.AnalysisReporter;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for AnalysisService and AnalysisVerticle on a real event bus.
 */
@ExtendWith(VertxExtension.class)
public class AnalysisServiceTest {

  private static final String ADDRESS = "loadlens.analysis.test";
  private static final long START = 1_700_000_000_000L;

  private AnalysisVerticle verticle;

  @BeforeEach
  void deploy(Vertx vertx, VertxTestContext testContext) {
    verticle = new AnalysisVerticle(ADDRESS, new AnalysisService(vertx, AnalysisReporter.NOOP));
    vertx.deployVerticle(verticle).onComplete(testContext.succeedingThenComplete());
  }

  private static JsonObject flatTest() {
    JsonArray samples = new JsonArray();
    for (int i = 0; i < 30; i++) {
      long ts = START + i * 10_000L;
      samples.add(new JsonObject().put("timestamp", ts).put("metric", "users").put("value", 10));
      samples.add(new JsonObject().put("timestamp", ts).put("metric", "throughput").put("value", 50 + i % 2));
      samples.add(new JsonObject().put("timestamp", ts).put("metric", "rt_avg").put("value", 100 + i % 2));
    }
    return new JsonObject().put("settings", new JsonObject()).put("samples", samples);
  }

  @Test
  void validRequest_repliesWithResult(Vertx vertx, VertxTestContext testContext) {
    assertTrue(verticle.isReady());
    vertx.eventBus().<JsonObject>request(ADDRESS, flatTest())
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        JsonObject body = reply.body();
        assertEquals("ok", body.getString("status"));
        assertEquals("fixed_load", body.getString("mode"));
        assertEquals("anomalies", body.getJsonObject("events").getString("id"));
        testContext.completeNow();
      })));
  }

  @Test
  void malformedRequest_failsWithBadRequest(Vertx vertx, VertxTestContext testContext) {
    vertx.eventBus().request(ADDRESS, new JsonObject().put("samples", "none"))
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        ReplyException reply = assertInstanceOf(ReplyException.class, err);
        assertEquals(AnalysisVerticle.BAD_REQUEST, reply.failureCode());
        testContext.completeNow();
      })));
  }

  @Test
  void nonJsonBody_failsWithBadRequest(Vertx vertx, VertxTestContext testContext) {
    vertx.eventBus().request(ADDRESS, "analyze please")
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        assertEquals(AnalysisVerticle.BAD_REQUEST, ((ReplyException) err).failureCode());
        testContext.completeNow();
      })));
  }

  @Test
  void noSamples_insufficientData(Vertx vertx, VertxTestContext testContext) {
    new AnalysisService(vertx, AnalysisReporter.NOOP)
      .analyze(new JsonObject().put("samples", new JsonArray()))
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals("insufficient_data", result.getString("status"));
        testContext.completeNow();
      })));
  }
}
