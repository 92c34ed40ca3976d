package io.github.themoah.loadlens.service;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event-bus consumer answering analysis requests.
 *
 * <p>Replies with the result document. Malformed requests fail with code
 * {@value #BAD_REQUEST}, anything else with {@value #INTERNAL_ERROR}.
 */
public class AnalysisVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(AnalysisVerticle.class);

  public static final int BAD_REQUEST = 400;
  public static final int INTERNAL_ERROR = 500;

  private final String address;
  private final AnalysisService analysisService;
  private final AtomicBoolean ready = new AtomicBoolean(false);
  private MessageConsumer<Object> consumer;

  public AnalysisVerticle(String address, AnalysisService analysisService) {
    this.address = address;
    this.analysisService = analysisService;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    consumer = vertx.eventBus().consumer(address, this::handle);
    consumer.completion()
      .onSuccess(v -> {
        ready.set(true);
        log.info("Analysis consumer registered at {}", address);
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to register analysis consumer at {}", address, err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    ready.set(false);
    if (consumer == null) {
      stopPromise.complete();
      return;
    }
    consumer.unregister()
      .onSuccess(v -> {
        log.info("Analysis consumer unregistered from {}", address);
        stopPromise.complete();
      })
      .onFailure(stopPromise::fail);
  }

  /**
   * Whether the consumer is registered and accepting requests.
   */
  public boolean isReady() {
    return ready.get();
  }

  private void handle(Message<Object> message) {
    if (!(message.body() instanceof JsonObject body)) {
      message.fail(BAD_REQUEST, "Analysis request must be a JSON object");
      return;
    }
    analysisService.analyze(body)
      .onSuccess(message::reply)
      .onFailure(err -> {
        if (err instanceof AnalysisRequestException) {
          message.fail(BAD_REQUEST, err.getMessage());
        } else {
          log.warn("Analysis failed", err);
          message.fail(INTERNAL_ERROR, String.valueOf(err.getMessage()));
        }
      });
  }
}
