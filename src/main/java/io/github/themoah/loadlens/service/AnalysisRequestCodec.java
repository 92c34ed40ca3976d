package io.github.themoah.loadlens.service;

import io.github.themoah.loadlens.model.Sample;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes analysis requests of the form
 * {@code {"settings": {...}, "samples": [{"timestamp", "metric", "value", "scope"}]}}.
 *
 * <p>Timestamps are epoch milliseconds or ISO-8601 strings. A missing scope means
 * {@code overall}. A {@code null} value is kept as a missing reading.
 */
public final class AnalysisRequestCodec {

  private AnalysisRequestCodec() {}

  public static AnalysisRequest decode(JsonObject body) throws AnalysisRequestException {
    if (body == null) {
      throw new AnalysisRequestException("Request body is missing");
    }
    Object rawSettings = body.getValue("settings");
    Map<String, Object> settings = new HashMap<>();
    if (rawSettings instanceof JsonObject json) {
      for (Map.Entry<String, Object> entry : json) {
        Object value = entry.getValue();
        if (value instanceof JsonArray list) {
          value = list.getList();
        }
        if (value != null) {
          settings.put(entry.getKey(), value);
        }
      }
    } else if (rawSettings != null) {
      throw new AnalysisRequestException("'settings' must be an object");
    }

    Object rawSamples = body.getValue("samples");
    if (!(rawSamples instanceof JsonArray array)) {
      throw new AnalysisRequestException("'samples' must be an array");
    }
    List<Sample> samples = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      Object item = array.getValue(i);
      if (!(item instanceof JsonObject sample)) {
        throw new AnalysisRequestException("samples[" + i + "] must be an object");
      }
      samples.add(decodeSample(sample, i));
    }
    return new AnalysisRequest(settings, samples);
  }

  private static Sample decodeSample(JsonObject sample, int index) throws AnalysisRequestException {
    String metric = sample.getValue("metric") instanceof String s ? s : null;
    if (metric == null || metric.isBlank()) {
      throw new AnalysisRequestException("samples[" + index + "].metric is required");
    }
    Object rawValue = sample.getValue("value");
    double value;
    if (rawValue == null) {
      value = Double.NaN;
    } else if (rawValue instanceof Number number) {
      value = number.doubleValue();
    } else {
      throw new AnalysisRequestException("samples[" + index + "].value must be a number");
    }
    Object rawScope = sample.getValue("scope");
    String scope = rawScope instanceof String s && !s.isBlank() ? s : ScopeFrame.OVERALL;
    return new Sample(parseTimestamp(sample.getValue("timestamp"), index), metric, value, scope);
  }

  static long parseTimestamp(Object raw, int index) throws AnalysisRequestException {
    if (raw instanceof Number number) {
      return number.longValue();
    }
    if (raw instanceof String text && !text.isBlank()) {
      try {
        return Instant.parse(text).toEpochMilli();
      } catch (DateTimeParseException e) {
        try {
          return OffsetDateTime.parse(text).toInstant().toEpochMilli();
        } catch (DateTimeParseException nested) {
          throw new AnalysisRequestException("samples[" + index + "].timestamp is not ISO-8601: " + text, nested);
        }
      }
    }
    throw new AnalysisRequestException("samples[" + index + "].timestamp is required");
  }
}
