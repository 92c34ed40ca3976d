package io.github.themoah.loadlens.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options for the analysis service.
 * Analyses run on the worker pool, so its size bounds concurrent runs.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);

  public static VertxOptions createVertxOptions(AppConfig appConfig) {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setWorkerPoolSize(appConfig.workerPoolSize());
    log.info("Worker pool size set to {}", appConfig.workerPoolSize());
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }
}
