package io.github.themoah.loadlens.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param analysis analysis consumer state ({@code null} for liveness)
 */
public record HealthCheckResponse(
  Status status,
  String analysis
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(Status.UP, null);
  }

  /**
   * Readiness is UP once the analysis consumer accepts requests.
   */
  public static HealthCheckResponse readiness(boolean consumerRegistered) {
    return consumerRegistered
      ? new HealthCheckResponse(Status.UP, "accepting")
      : new HealthCheckResponse(Status.DOWN, "unavailable");
  }

  public int httpStatus() {
    return status == Status.UP ? 200 : 503;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (analysis != null) {
      json.put("analysis", analysis);
    }
    return json;
  }

  public enum Status {
    UP,
    DOWN
  }
}
