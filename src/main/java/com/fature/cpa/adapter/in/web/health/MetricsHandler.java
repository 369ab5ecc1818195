package com.fature.cpa.adapter.in.web.health;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Prometheus scrape endpoint
 * Handles GET /metrics
 */
@RequiredArgsConstructor
public class MetricsHandler implements Handler<RoutingContext> {

    private static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry registry;

    @Override
    public void handle(RoutingContext context) {
        context.response()
                .putHeader("Content-Type", CONTENT_TYPE)
                .end(registry.scrape());
    }
}
