package io.github.themoah.loadlens.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerConfig.
 */
public class MicrometerConfigTest {

  @Test
  void otlpUrl_precedence() {
    assertEquals("http://a:4318/custom", MicrometerConfig.otlpUrl(Map.of(
      "OTLP_ENDPOINT", "http://a:4318/custom",
      "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT", "http://b:4318/v1/metrics")));
    assertEquals("http://b:4318/v1/metrics", MicrometerConfig.otlpUrl(Map.of(
      "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT", "http://b:4318/v1/metrics",
      "OTEL_EXPORTER_OTLP_ENDPOINT", "http://c:4318")));
    assertEquals("http://c:4318/v1/metrics", MicrometerConfig.otlpUrl(Map.of(
      "OTEL_EXPORTER_OTLP_ENDPOINT", "http://c:4318")));
    assertEquals("http://localhost:4318/v1/metrics", MicrometerConfig.otlpUrl(Map.of()));
  }

  @Test
  void parseKeyValues_skipsMalformedPairs() {
    Map<String, String> parsed = MicrometerConfig.parseKeyValues("env=prod, team = perf ,broken");

    assertEquals(Map.of("env", "prod", "team", "perf"), parsed);
    assertTrue(MicrometerConfig.parseKeyValues(null).isEmpty());
  }

  @Test
  void datadogUri_defaultsToUsSite() {
    assertEquals("https://api.datadoghq.com", MicrometerConfig.datadogUri(null));
    assertEquals("https://api.datadoghq.eu", MicrometerConfig.datadogUri("datadoghq.eu"));
  }

  @Test
  void createRegistry_byType() {
    MeterRegistry prometheus = MicrometerConfig.createRegistry("Prometheus");
    try {
      assertInstanceOf(PrometheusMeterRegistry.class, prometheus);
    } finally {
      prometheus.close();
    }
    assertNull(MicrometerConfig.createRegistry("graphite"));
    assertNull(MicrometerConfig.createRegistry(null));
  }
}
