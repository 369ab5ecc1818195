package com.fature.cpa.adapter.in.web;

import com.fature.cpa.adapter.in.web.health.HealthHandler;
import com.fature.cpa.adapter.in.web.health.MetricsHandler;
import com.fature.cpa.adapter.in.web.health.ServiceStatusHandler;
import com.fature.cpa.adapter.in.web.validation.ActiveRulesHandler;
import com.fature.cpa.adapter.in.web.validation.CpaScenarioHandler;
import com.fature.cpa.adapter.in.web.validation.CpaValidationHandler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * Router configuration for the CPA endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    public static final String SERVICE_NAME = "integration-service";
    public static final String VERSION = "1.0.0";
    static final String API_BASE = "/api/v1/" + SERVICE_NAME;

    private final Router router;
    private final CpaValidationHandler validationHandler;
    private final ActiveRulesHandler activeRulesHandler;
    private final CpaScenarioHandler scenarioHandler;
    private final HealthHandler healthHandler;
    private final ServiceStatusHandler statusHandler;
    private final MetricsHandler metricsHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options(API_BASE + "/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post(API_BASE + "/validate-cpa")
                .handler(BodyHandler.create())
                .handler(validationHandler);

        router.get(API_BASE + "/cpa-rules").handler(activeRulesHandler);

        router.post(API_BASE + "/test-cpa").handler(scenarioHandler);

        router.get(API_BASE).handler(ctx -> ctx.response()
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("service", SERVICE_NAME)
                        .put("message", "CPA validation service")
                        .put("timestamp", Instant.now().toString())
                        .put("data", new JsonObject()
                                .put("status", "operational")
                                .put("features", new JsonArray()
                                        .add("CPA validation")
                                        .add("Configurable rules")
                                        .add("Fraud detection")
                                        .add("Multi-tier configuration cache")))
                        .encode()));

        router.get(API_BASE + "/status").handler(statusHandler);

        router.get("/health").handler(healthHandler);
        router.get("/metrics").handler(metricsHandler);

        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end(new JsonObject()
                                .put("service", SERVICE_NAME)
                                .put("version", VERSION)
                                .put("endpoints", new JsonObject()
                                        .put("health", "/health")
                                        .put("metrics", "/metrics")
                                        .put("cpaValidation", API_BASE + "/validate-cpa")
                                        .put("cpaRules", API_BASE + "/cpa-rules")
                                        .put("cpaScenarios", API_BASE + "/test-cpa")
                                        .put("serviceInfo", API_BASE)
                                        .put("serviceStatus", API_BASE + "/status"))
                                .encode()));
    }
}
