package io.github.themoah.loadlens;

import io.github.themoah.loadlens.config.AppConfig;
import io.github.themoah.loadlens.config.MetricsConfig;
import io.github.themoah.loadlens.health.HealthCheckHandler;
import io.github.themoah.loadlens.metrics.AnalysisReporter;
import io.github.themoah.loadlens.metrics.MicrometerAnalysisReporter;
import io.github.themoah.loadlens.metrics.MicrometerConfig;
import io.github.themoah.loadlens.service.AnalysisService;
import io.github.themoah.loadlens.service.AnalysisVerticle;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for loadlens.
 * Wires metrics, deploys the analysis consumer and serves health and metrics over HTTP.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);
  private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private final AppConfig appConfig;
  private AnalysisReporter reporter = AnalysisReporter.NOOP;
  private AnalysisVerticle analysisVerticle;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment());
  }

  public MainVerticle(AppConfig appConfig) {
    this.appConfig = appConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting loadlens MainVerticle");

    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    Router router = Router.router(vertx);
    reporter = createReporter(metricsConfig, router);

    analysisVerticle = new AnalysisVerticle(appConfig.analysisAddress(), new AnalysisService(vertx, reporter));
    new HealthCheckHandler(analysisVerticle::isReady).registerRoutes(router);

    router.route().handler(ctx -> ctx.response()
      .setStatusCode(404)
      .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
      .end("{\"error\": \"Not Found\"}"));

    vertx.deployVerticle(analysisVerticle)
      .compose(id -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("loadlens started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start loadlens", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping loadlens MainVerticle");

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHttpServer
      .compose(v -> reporter.close())
      .onSuccess(v -> {
        log.info("loadlens stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during loadlens shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private AnalysisReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return AnalysisReporter.NOOP;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return AnalysisReporter.NOOP;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      router.get("/metrics").handler(ctx -> ctx.response()
        .putHeader(HttpHeaders.CONTENT_TYPE, PROMETHEUS_CONTENT_TYPE)
        .end(prometheusRegistry.scrape()));
      log.info("Analysis metrics exposed for scraping at /metrics");
    }
    return new MicrometerAnalysisReporter(registry);
  }
}
