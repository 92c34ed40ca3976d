package io.github.themoah.loadlens.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.model.Sample;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnalysisRequestCodec.
 */
public class AnalysisRequestCodecTest {

  private static JsonObject sample(Object timestamp, String metric, Object value, String scope) {
    JsonObject json = new JsonObject().put("timestamp", timestamp).put("metric", metric).put("value", value);
    if (scope != null) {
      json.put("scope", scope);
    }
    return json;
  }

  @Test
  void decode_samplesAndSettings() throws AnalysisRequestException {
    JsonObject body = new JsonObject()
      .put("settings", new JsonObject()
        .put("z_score_threshold", 4.0)
        .put("overall_metrics", new JsonArray().add("rt_avg"))
        .put("ignored", null))
      .put("samples", new JsonArray()
        .add(sample(1000L, "rt_avg", 120.5, null))
        .add(sample(1000L, "rps", 3, "login")));

    AnalysisRequest request = AnalysisRequestCodec.decode(body);

    assertEquals(4.0, request.settings().get("z_score_threshold"));
    assertEquals(List.of("rt_avg"), request.settings().get("overall_metrics"));
    assertTrue(!request.settings().containsKey("ignored"));
    assertEquals(List.of(
      new Sample(1000L, "rt_avg", 120.5, "overall"),
      new Sample(1000L, "rps", 3.0, "login")), request.samples());
  }

  @Test
  void decode_isoTimestamps() throws AnalysisRequestException {
    JsonObject body = new JsonObject().put("samples", new JsonArray()
      .add(sample("2023-11-14T10:00:00Z", "rt_avg", 1, null))
      .add(sample("2023-11-14T12:00:00+02:00", "rt_avg", 2, null)));

    List<Sample> samples = AnalysisRequestCodec.decode(body).samples();

    assertEquals(1_699_956_000_000L, samples.get(0).timestamp());
    assertEquals(1_699_956_000_000L, samples.get(1).timestamp());
  }

  @Test
  void decode_nullValueIsMissing() throws AnalysisRequestException {
    JsonObject body = new JsonObject().put("samples", new JsonArray().add(sample(1L, "rt_avg", null, null)));

    assertTrue(Double.isNaN(AnalysisRequestCodec.decode(body).samples().get(0).value()));
  }

  @Test
  void decode_rejectsMalformedRequests() {
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(null));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(new JsonObject()));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(
      new JsonObject().put("settings", "fast").put("samples", new JsonArray())));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(
      new JsonObject().put("samples", new JsonArray().add(sample(1L, null, 1, null)))));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(
      new JsonObject().put("samples", new JsonArray().add(sample(1L, "rt_avg", "fast", null)))));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(
      new JsonObject().put("samples", new JsonArray().add(sample("yesterday", "rt_avg", 1, null)))));
    assertThrows(AnalysisRequestException.class, () -> AnalysisRequestCodec.decode(
      new JsonObject().put("samples", new JsonArray().add("not an object"))));
  }
}
