package io.github.themoah.loadlens.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port for health and metrics
 * @param analysisAddress event-bus address the analysis consumer listens on
 * @param workerPoolSize size of the worker pool running analyses
 */
public record AppConfig(
  int httpPort,
  String analysisAddress,
  int workerPoolSize
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  public static final String DEFAULT_ANALYSIS_ADDRESS = "loadlens.analysis";
  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final int DEFAULT_WORKER_POOL_SIZE = 4;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    String address = getEnvString("ANALYSIS_ADDRESS", DEFAULT_ANALYSIS_ADDRESS);
    int poolSize = getEnvInt("ANALYSIS_WORKER_POOL_SIZE", DEFAULT_WORKER_POOL_SIZE);
    if (poolSize < 1) {
      log.warn("ANALYSIS_WORKER_POOL_SIZE must be positive: {}, using default: {}", poolSize, DEFAULT_WORKER_POOL_SIZE);
      poolSize = DEFAULT_WORKER_POOL_SIZE;
    }

    log.info("AppConfig loaded: httpPort={}, analysisAddress={}, workerPoolSize={}", port, address, poolSize);
    return new AppConfig(port, address, poolSize);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static String getEnvString(String name, String defaultValue) {
    String value = System.getenv(name);
    return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
  }
}
