package io.github.themoah.loadlens.config;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration loaded from environment variables.
 *
 * @param enabled whether a meter registry is created at all
 * @param reporterType registry backend: {@code prometheus}, {@code otlp} or {@code datadog}
 * @param jvmMetricsEnabled whether JVM binders are attached to the registry
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public static MetricsConfig fromEnvironment() {
    boolean enabled = getEnvBoolean("METRICS_ENABLED", true);
    String reporter = System.getenv("METRICS_REPORTER");
    if (reporter == null || reporter.isBlank()) {
      reporter = DEFAULT_REPORTER;
    }
    boolean jvm = getEnvBoolean("METRICS_JVM_ENABLED", true);

    MetricsConfig config = new MetricsConfig(enabled, reporter.trim().toLowerCase(Locale.ROOT), jvm);
    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}",
      config.enabled(), config.reporterType(), config.jvmMetricsEnabled());
    return config;
  }

  public boolean isEnabled() {
    return enabled;
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true") || normalized.equals("false")) {
      return Boolean.parseBoolean(normalized);
    }
    log.warn("Invalid boolean for {}: {}, using default: {}", name, value, defaultValue);
    return defaultValue;
  }
}
