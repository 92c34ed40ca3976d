package io.github.themoah.loadlens;

import io.github.themoah.loadlens.config.AppConfig;
import io.github.themoah.loadlens.config.VertxConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates Vert.x with a worker pool sized for analyses and deploys {@link MainVerticle}.
 */
public class LoadLensLauncher {

  private static final Logger log = LoggerFactory.getLogger(LoadLensLauncher.class);

  public static void main(String[] args) {
    AppConfig appConfig = AppConfig.fromEnvironment();
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions(appConfig));

    vertx.deployVerticle(new MainVerticle(appConfig), VertxConfig.createDeploymentOptions())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
