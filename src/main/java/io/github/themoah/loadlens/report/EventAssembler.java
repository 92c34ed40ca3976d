package io.github.themoah.loadlens.report;

import io.github.themoah.loadlens.model.AnalysisResult;
import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricContribution;
import io.github.themoah.loadlens.model.MetricNames;
import io.github.themoah.loadlens.model.Segmentation;
import io.github.themoah.loadlens.model.TransactionCandidate;
import io.github.themoah.loadlens.model.TransactionContribution;
import io.github.themoah.loadlens.model.TransactionSelection;
import io.github.themoah.loadlens.model.TrendFinding;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts analysis results into the JSON documents consumed by the reporting
 * and chart layers.
 *
 * <p>Output is a pure function of the result: the same result always encodes
 * to the same JSON. Non-finite numbers are written as {@code null}.
 */
public final class EventAssembler {

  public static final String DEFAULT_DATASET_ID = "anomalies";
  public static final String DEFAULT_DATASET_NAME = "Anomalies";

  static final int MAX_NAMED_CONTRIBUTORS = 3;
  private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

  private EventAssembler() {}

  /**
   * Builds the full result document.
   */
  public static JsonObject toJson(AnalysisResult result) {
    JsonObject json = new JsonObject()
      .put("status", result.status().label());
    if (result.isInsufficientData()) {
      return json
        .put("events", toDataset(DEFAULT_DATASET_ID, DEFAULT_DATASET_NAME, List.of()))
        .put("windows", new JsonObject());
    }
    return json
      .put("mode", result.mode().label())
      .put("segmentation", segmentationJson(result.segmentation()))
      .put("findings", new JsonObject()
        .put("ramp_up", rampUpFinding(result.segmentation()))
        .put("trends", trendsJson(result.trendFindings())))
      .put("transaction_selection", selectionJson(result.transactionSelection()))
      .put("events", toDataset(DEFAULT_DATASET_ID, DEFAULT_DATASET_NAME, result.events()))
      .put("windows", chartWindows(result.windowsByScope()));
  }

  /**
   * Wraps ranked events in an events dataset.
   */
  public static JsonObject toDataset(String id, String name, List<MergedEvent> events) {
    JsonArray items = new JsonArray();
    events.forEach(event -> items.add(eventJson(event)));
    return new JsonObject()
      .put("id", id)
      .put("type", "events")
      .put("name", name)
      .put("events", items);
  }

  public static JsonObject eventJson(MergedEvent event) {
    JsonArray metrics = new JsonArray();
    for (MetricContribution metric : event.metrics()) {
      metrics.add(new JsonObject()
        .put("name", metric.name())
        .put("delta_pct", round(metric.deltaPct(), 2))
        .put("severity", metric.severity().label()));
    }
    JsonArray transactions = new JsonArray();
    for (TransactionContribution contributor : event.contributors()) {
      transactions.add(new JsonObject()
        .put("name", contributor.transaction())
        .put("share", round(contributor.share(), 4))
        .put("direction", contributor.direction().label())
        .put("overlap_sec", round(contributor.overlapSec(), 1)));
    }
    JsonObject volume = new JsonObject()
      .put("mean_rps", event.volume() == null ? null : round(event.volume().meanRps(), 3))
      .put("share", event.volume() == null ? null : round(event.volume().share(), 4));

    JsonObject meta = new JsonObject()
      .put("scope", event.scope())
      .put("window", new JsonObject()
        .put("start", event.start())
        .put("end", event.end())
        .put("durationSec", round(event.durationSec(), 1)))
      .put("metrics", metrics)
      .put("volume", volume)
      .put("impact", round(event.impact(), 4))
      .put("methods", new JsonArray(List.copyOf(event.methods())))
      .put("direction", event.direction().label())
      .put("transactions", transactions);

    return new JsonObject()
      .put("timestamp", event.start())
      .put("type", "anomaly")
      .put("severity", event.severity().label())
      .put("message", message(event))
      .put("meta", meta);
  }

  /**
   * Human-readable summary, for example
   * {@code Average response time 10:02:00–10:04:00: increased by 42.0% (critical).}
   */
  public static String message(MergedEvent event) {
    MetricContribution strongest = event.metrics().get(0);
    String names = event.metrics().stream()
      .map(metric -> MetricNames.displayName(metric.name()))
      .collect(Collectors.joining(", "));
    StringBuilder message = new StringBuilder();
    if (!event.isOverall()) {
      message.append("Transaction ").append(event.scope()).append(": ");
    }
    message.append(names)
      .append(' ').append(CLOCK.format(Instant.ofEpochMilli(event.start())))
      .append('–').append(CLOCK.format(Instant.ofEpochMilli(event.end())))
      .append(": ").append(event.direction().verb())
      .append(" by ").append(String.format(Locale.ROOT, "%.1f", Math.abs(strongest.deltaPct()))).append('%')
      .append(" (").append(event.severity().label()).append(").");

    List<TransactionContribution> contributors = event.contributors();
    if (!contributors.isEmpty()) {
      String named = contributors.stream()
        .limit(MAX_NAMED_CONTRIBUTORS)
        .map(c -> c.transaction() + " (" + c.direction().label() + ")")
        .collect(Collectors.joining(", "));
      message.append(" Likely contributing transactions: ").append(named).append('.');
    }
    return message.toString();
  }

  /**
   * Windows keyed by scope, then metric, for chart overlays.
   */
  public static JsonObject chartWindows(Map<String, Map<String, List<AnomalyWindow>>> windowsByScope) {
    JsonObject byScope = new JsonObject();
    windowsByScope.forEach((scope, byMetric) -> {
      JsonObject metrics = new JsonObject();
      byMetric.forEach((metric, windows) -> {
        JsonArray items = new JsonArray();
        for (AnomalyWindow window : windows) {
          items.add(new JsonObject()
            .put("start", window.start())
            .put("end", window.end())
            .put("delta_pct", round(window.deltaPct(), 2))
            .put("severity", window.severity().label())
            .put("direction", window.direction().label()));
        }
        metrics.put(metric, items);
      });
      byScope.put(scope, metrics);
    });
    return byScope;
  }

  static JsonObject rampUpFinding(Segmentation segmentation) {
    Segmentation.SaturationPoint saturation = segmentation.saturation();
    if (saturation == null) {
      return new JsonObject()
        .put("status", "passed")
        .put("description", "Users ramped up successfully.")
        .put("value", null);
    }
    return new JsonObject()
      .put("status", "failed")
      .put("description", String.format(Locale.ROOT,
        "Tipping point was reached at %s requests per second with a load of %s according to throughput analysis.",
        formatNumber(saturation.throughput()), formatNumber(saturation.load())))
      .put("value", round(saturation.throughput(), 2))
      .put("timestamp", saturation.timestamp());
  }

  private static JsonObject segmentationJson(Segmentation segmentation) {
    return new JsonObject()
      .put("split_index", segmentation.splitIndex())
      .put("split_timestamp", segmentation.splitTimestamp())
      .put("tipping_point_found", segmentation.tippingPointFound())
      .put("stable_fraction", round(segmentation.stableFraction(), 4))
      .put("fixed_load", segmentation.fixedLoad());
  }

  private static JsonArray trendsJson(List<TrendFinding> findings) {
    JsonArray trends = new JsonArray();
    for (TrendFinding finding : findings) {
      trends.add(new JsonObject()
        .put("metric", finding.metric())
        .put("trend", finding.trend().label())
        .put("status", finding.trend().passed() ? "passed" : "failed")
        .put("slope", round(finding.slope(), 6))
        .put("cv", round(finding.cv(), 4))
        .put("p_value", round(finding.pValue(), 4)));
    }
    return trends;
  }

  private static JsonObject selectionJson(TransactionSelection selection) {
    JsonArray selected = new JsonArray();
    for (TransactionCandidate candidate : selection.selected()) {
      selected.add(new JsonObject()
        .put("name", candidate.name())
        .put("mean_rps", round(candidate.meanRps(), 3))
        .put("share", round(candidate.volumeShare(), 4))
        .put("sample_count", candidate.sampleCount()));
    }
    return new JsonObject()
      .put("total", selection.totalTransactions())
      .put("eligible", selection.eligibleTransactions())
      .put("cumulative_share", round(selection.cumulativeShare(), 4))
      .put("selected", selected);
  }

  static Double round(double value, int places) {
    if (!Double.isFinite(value)) {
      return null;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  private static String formatNumber(double value) {
    if (!Double.isFinite(value)) {
      return "n/a";
    }
    if (value == Math.rint(value)) {
      return String.valueOf((long) value);
    }
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
