package com.fature.cpa.adapter.in.web.health;

import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.lang.management.ManagementFactory;
import java.time.Clock;

/**
 * Process status: uptime and heap usage
 * Handles GET /api/v1/integration-service/status
 */
@RequiredArgsConstructor
public class ServiceStatusHandler implements Handler<RoutingContext> {

    private final String serviceName;
    private final Clock clock;

    @Override
    public void handle(RoutingContext context) {
        Runtime runtime = Runtime.getRuntime();
        context.response()
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("service", serviceName)
                        .put("status", "running")
                        .put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0)
                        .put("memory", new JsonObject()
                                .put("totalBytes", runtime.totalMemory())
                                .put("freeBytes", runtime.freeMemory())
                                .put("usedBytes", runtime.totalMemory() - runtime.freeMemory())
                                .put("maxBytes", runtime.maxMemory()))
                        .put("timestamp", clock.instant().toString())
                        .encode());
    }
}
