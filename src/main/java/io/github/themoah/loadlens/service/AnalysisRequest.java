package io.github.themoah.loadlens.service;

import io.github.themoah.loadlens.model.Sample;
import java.util.List;
import java.util.Map;

/**
 * Decoded analysis request.
 *
 * @param settings the raw settings dictionary
 * @param samples telemetry samples of all scopes
 */
public record AnalysisRequest(
  Map<String, Object> settings,
  List<Sample> samples
) {

  public AnalysisRequest {
    settings = settings == null ? Map.of() : Map.copyOf(settings);
    samples = List.copyOf(samples);
  }
}
