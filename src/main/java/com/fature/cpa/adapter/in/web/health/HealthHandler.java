package com.fature.cpa.adapter.in.web.health;

import com.fature.cpa.application.port.in.HealthCheckUseCase;
import com.fature.cpa.domain.model.HealthReport;
import com.fature.cpa.domain.model.HealthReport.ComponentHealth;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Liveness / readiness endpoint
 * Handles GET /health
 */
@Slf4j
@RequiredArgsConstructor
public class HealthHandler implements Handler<RoutingContext> {

    private final HealthCheckUseCase healthCheck;
    private final String serviceName;
    private final String version;

    @Override
    public void handle(RoutingContext context) {
        healthCheck.check()
                .onSuccess(report -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(new JsonObject()
                                .put("status", "ok")
                                .put("service", serviceName)
                                .put("version", version)
                                .put("timestamp", Instant.now().toString())
                                .put("components", new JsonObject().put("cpaEngine", toJson(report)))
                                .encode()))
                .onFailure(error -> {
                    log.error("Health check failed", error);
                    context.response()
                            .setStatusCode(503)
                            .putHeader("Content-Type", "application/json")
                            .end(new JsonObject()
                                    .put("status", "degraded")
                                    .put("service", serviceName)
                                    .put("timestamp", Instant.now().toString())
                                    .put("error", error.getMessage())
                                    .encode());
                });
    }

    static JsonObject toJson(HealthReport report) {
        return new JsonObject()
                .put("status", report.overall().getValue())
                .put("timestamp", report.timestamp().toString())
                .put("components", new JsonObject()
                        .put("configService", toJson(report.origin()))
                        .put("redis", toJson(report.remoteCache()))
                        .put("localCache", new JsonObject()
                                .put("status", "healthy")
                                .put("size", report.localCache().size())
                                .put("ttlMs", report.localCache().ttl().toMillis())));
    }

    private static JsonObject toJson(ComponentHealth component) {
        JsonObject json = new JsonObject()
                .put("status", component.status())
                .put("url", component.location());
        if (component.error() != null) {
            json.put("error", component.error());
        }
        return json;
    }
}
