package io.github.themoah.loadlens.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";

  private MicrometerConfig() {}

  /**
   * Creates a Datadog meter registry from {@code DD_API_KEY}, {@code DD_APP_KEY} and {@code DD_SITE}.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return datadogUri(System.getenv("DD_SITE"));
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates a Prometheus meter registry.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP meter registry configured from environment variables.
   * {@code OTLP_ENDPOINT} wins over {@code OTEL_EXPORTER_OTLP_METRICS_ENDPOINT},
   * which wins over {@code OTEL_EXPORTER_OTLP_ENDPOINT} plus {@code /v1/metrics}.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return otlpUrl(System.getenv());
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        String stepMs = firstNonBlank(System.getenv("OTLP_STEP_MS"), System.getenv("OTEL_METRIC_EXPORT_INTERVAL"));
        if (stepMs != null) {
          try {
            return Duration.ofMillis(Long.parseLong(stepMs.trim()));
          } catch (NumberFormatException e) {
            log.warn("Invalid OTLP export interval: {}, using default 60s", stepMs);
          }
        }
        return Duration.ofSeconds(60);
      }

      @Override
      public Map<String, String> headers() {
        return parseKeyValues(firstNonBlank(
          System.getenv("OTLP_HEADERS"),
          System.getenv("OTEL_EXPORTER_OTLP_METRICS_HEADERS"),
          System.getenv("OTEL_EXPORTER_OTLP_HEADERS")));
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = new HashMap<>(parseKeyValues(System.getenv("OTEL_RESOURCE_ATTRIBUTES")));
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        if (serviceName != null && !serviceName.isBlank()) {
          attributes.put("service.name", serviceName);
        }
        attributes.putIfAbsent("service.name", "loadlens");
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}, temporality: {}",
      config.url(), config.aggregationTemporality());
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType {@code prometheus}, {@code otlp} or {@code datadog}
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }
    return switch (reporterType.toLowerCase(Locale.ROOT)) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      case "datadog" -> createDatadogRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static String datadogUri(String site) {
    String host = site == null || site.isBlank() ? "datadoghq.com" : site.trim();
    return "https://api." + host;
  }

  static String otlpUrl(Map<String, String> env) {
    String url = firstNonBlank(env.get("OTLP_ENDPOINT"), env.get("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT"));
    if (url != null) {
      return url;
    }
    String base = env.get("OTEL_EXPORTER_OTLP_ENDPOINT");
    if (base != null && !base.isBlank()) {
      return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
    }
    return DEFAULT_OTLP_URL;
  }

  /**
   * Parses {@code key1=value1,key2=value2}; malformed pairs are logged and skipped.
   */
  static Map<String, String> parseKeyValues(String text) {
    Map<String, String> pairs = new HashMap<>();
    if (text == null || text.isBlank()) {
      return pairs;
    }
    for (String pair : text.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        pairs.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return pairs;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
