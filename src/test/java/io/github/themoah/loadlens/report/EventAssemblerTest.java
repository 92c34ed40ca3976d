package io.github.themoah.loadlens.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.AnalysisResult;
import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.Direction;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricContribution;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Segmentation;
import io.github.themoah.loadlens.model.Severity;
import io.github.themoah.loadlens.model.TrafficVolume;
import io.github.themoah.loadlens.model.TransactionContribution;
import io.github.themoah.loadlens.model.TransactionSelection;
import io.github.themoah.loadlens.model.TrendFinding;
import io.github.themoah.loadlens.model.TrendFinding.Trend;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EventAssembler.
 */
public class EventAssemblerTest {

  // 2023-11-14T10:00:00Z
  private static final long T0 = 1_699_956_000_000L;

  private static MergedEvent overallEvent(List<TransactionContribution> contributors) {
    return new MergedEvent(ScopeFrame.OVERALL, T0, T0 + 120_000L,
      List.of(new MetricContribution("rt_avg", 42.04, Severity.HIGH),
        new MetricContribution("error_rate", 21.0, Severity.LOW)),
      TrafficVolume.overall(200.0), Severity.HIGH, 7.5, Set.of("zscore", "isolation_forest"),
      Direction.INCREASE, contributors);
  }

  private static AnalysisResult result(List<MergedEvent> events, Segmentation segmentation) {
    AnomalyWindow window = new AnomalyWindow(ScopeFrame.OVERALL, "rt_avg", 12, 24, T0, T0 + 120_000L,
      42.04, Severity.HIGH, Set.of("zscore"), Direction.INCREASE, 100.0, 180.0);
    return new AnalysisResult(AnalysisResult.Status.OK, AnalysisMode.FIXED_LOAD, segmentation, events,
      Map.of(ScopeFrame.OVERALL, Map.of("rt_avg", List.of(window))), TransactionSelection.empty(),
      List.of(new TrendFinding("rt_avg", Trend.NOISY_BUT_STABLE, 0.0001, 0.05, 0.4)));
  }

  private static Segmentation healthyRamp() {
    return new Segmentation(6, T0 - 60_000L, true, 0.9, true, null);
  }

  @Test
  void message_describesStrongestMetric() {
    String message = EventAssembler.message(overallEvent(List.of()));

    assertEquals("Average response time, Error rate 10:00:00–10:02:00: increased by 42.0% (high).", message);
  }

  @Test
  void message_namesAtMostThreeContributors() {
    List<TransactionContribution> contributors = List.of(
      new TransactionContribution("checkout", 0.5, Direction.INCREASE, 60),
      new TransactionContribution("login", 0.3, Direction.INCREASE, 60),
      new TransactionContribution("search", 0.1, Direction.DECREASE, 60),
      new TransactionContribution("cart", 0.05, Direction.INCREASE, 60));

    String message = EventAssembler.message(overallEvent(contributors));

    assertTrue(message.endsWith(
      " Likely contributing transactions: checkout (increase), login (increase), search (decrease)."));
    assertFalse(message.contains("cart"));
  }

  @Test
  void message_prefixesTransactionScope() {
    MergedEvent event = new MergedEvent("login", T0, T0 + 60_000L,
      List.of(new MetricContribution("rt_ms_avg", -30.0, Severity.MEDIUM)),
      new TrafficVolume(20.0, 0.1), Severity.MEDIUM, 1.0, Set.of("zscore"), Direction.DECREASE, List.of());

    assertTrue(EventAssembler.message(event).startsWith("Transaction login: Response time (avg) 10:00:00"));
    assertTrue(EventAssembler.message(event).contains("decreased by 30.0% (medium)."));
  }

  @Test
  void eventJson_carriesMetadata() {
    JsonObject json = EventAssembler.eventJson(overallEvent(List.of()));

    assertEquals(T0, json.getLong("timestamp"));
    assertEquals("anomaly", json.getString("type"));
    assertEquals("high", json.getString("severity"));
    JsonObject meta = json.getJsonObject("meta");
    assertEquals("overall", meta.getString("scope"));
    assertEquals(120.0, meta.getJsonObject("window").getDouble("durationSec"));
    assertEquals(new JsonArray().add("isolation_forest").add("zscore"), meta.getJsonArray("methods"));
    assertEquals(42.04, meta.getJsonArray("metrics").getJsonObject(0).getDouble("delta_pct"));
    assertEquals("increase", meta.getString("direction"));
    assertEquals(1.0, meta.getJsonObject("volume").getDouble("share"));
  }

  @Test
  void toJson_fullDocument() {
    JsonObject json = EventAssembler.toJson(result(List.of(overallEvent(List.of())), healthyRamp()));

    assertEquals("ok", json.getString("status"));
    assertEquals("fixed_load", json.getString("mode"));
    assertEquals(6, json.getJsonObject("segmentation").getInteger("split_index"));
    assertEquals("passed", json.getJsonObject("findings").getJsonObject("ramp_up").getString("status"));
    JsonObject trend = json.getJsonObject("findings").getJsonArray("trends").getJsonObject(0);
    assertEquals("noisy but stable", trend.getString("trend"));
    assertEquals("passed", trend.getString("status"));

    JsonObject dataset = json.getJsonObject("events");
    assertEquals(EventAssembler.DEFAULT_DATASET_ID, dataset.getString("id"));
    assertEquals("events", dataset.getString("type"));
    assertEquals(1, dataset.getJsonArray("events").size());

    JsonArray windows = json.getJsonObject("windows").getJsonObject("overall").getJsonArray("rt_avg");
    assertEquals(T0, windows.getJsonObject(0).getLong("start"));
  }

  @Test
  void toJson_insufficientData() {
    JsonObject json = EventAssembler.toJson(AnalysisResult.insufficientData());

    assertEquals("insufficient_data", json.getString("status"));
    assertTrue(json.getJsonObject("events").getJsonArray("events").isEmpty());
    assertTrue(json.getJsonObject("windows").isEmpty());
    assertFalse(json.containsKey("mode"));
  }

  @Test
  void toJson_isDeterministic() {
    AnalysisResult result = result(List.of(overallEvent(List.of())), healthyRamp());

    assertEquals(EventAssembler.toJson(result).encode(), EventAssembler.toJson(result).encode());
  }

  @Test
  void rampUpFinding_reportsSaturation() {
    Segmentation saturated = new Segmentation(20, T0, true, 0.7, true,
      new Segmentation.SaturationPoint(T0, 200.0, 110.5));

    JsonObject finding = EventAssembler.rampUpFinding(saturated);

    assertEquals("failed", finding.getString("status"));
    assertEquals("Tipping point was reached at 200 requests per second with a load of 110.50 "
      + "according to throughput analysis.", finding.getString("description"));
    assertEquals(200.0, finding.getDouble("value"));
  }

  @Test
  void round_nonFiniteIsNull() {
    assertNull(EventAssembler.round(Double.NaN, 2));
    assertNull(EventAssembler.round(Double.POSITIVE_INFINITY, 2));
    assertEquals(1.23, EventAssembler.round(1.2345, 2));
  }
}
