package com.fature.cpa.adapter.in.web;

import com.fature.cpa.adapter.in.web.health.HealthHandler;
import com.fature.cpa.adapter.in.web.health.MetricsHandler;
import com.fature.cpa.adapter.in.web.health.ServiceStatusHandler;
import com.fature.cpa.adapter.in.web.validation.ActiveRulesHandler;
import com.fature.cpa.adapter.in.web.validation.CpaRequestValidator;
import com.fature.cpa.adapter.in.web.validation.CpaScenarioHandler;
import com.fature.cpa.adapter.in.web.validation.CpaValidationHandler;
import com.fature.cpa.adapter.out.http.ConfigServiceHttpAdapter;
import com.fature.cpa.adapter.out.metrics.MicrometerValidationMetrics;
import com.fature.cpa.adapter.out.redis.RedisConfigCacheAdapter;
import com.fature.cpa.application.port.in.CpaValidationUseCase;
import com.fature.cpa.application.port.in.HealthCheckUseCase;
import com.fature.cpa.application.port.out.ConfigurationOrigin;
import com.fature.cpa.application.port.out.ValidationMetrics;
import com.fature.cpa.application.service.ConfigurationCache;
import com.fature.cpa.application.service.HealthProbe;
import com.fature.cpa.application.service.LocalConfigCache;
import com.fature.cpa.application.service.RuleEvaluator;
import com.fature.cpa.domain.service.FraudHeuristics;
import com.fature.cpa.infrastructure.config.EngineConfig;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.core.net.NetClientOptions;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int REDIS_CONNECT_TIMEOUT_MS = 5000;

    private final Clock clock = Clock.systemUTC();

    private EngineConfig engineConfig;
    private WebClient webClient;
    private RedisConfigCacheAdapter remoteCache;
    private PrometheusMeterRegistry meterRegistry;
    private CpaValidationUseCase validationUseCase;
    private HealthCheckUseCase healthCheckUseCase;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        try {
            engineConfig = EngineConfig.fromJson(config());
        } catch (RuntimeException e) {
            log.error("Invalid configuration", e);
            startPromise.fail(e);
            return;
        }

        initializeServices();

        connectRemoteCache()
                .compose(v -> startHttpServer())
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", engineConfig.httpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (remoteCache != null) {
            remoteCache.close();
        }
        if (webClient != null) {
            webClient.close();
        }
        if (meterRegistry != null) {
            meterRegistry.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private void initializeServices() {
        // Output ports (adapters)
        meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        ValidationMetrics metrics = new MicrometerValidationMetrics(meterRegistry);

        webClient = WebClient.create(vertx);
        ConfigurationOrigin origin = new ConfigServiceHttpAdapter(
                webClient,
                engineConfig.originUrl(),
                engineConfig.originConfigurationsPath(),
                engineConfig.originTimeout(),
                engineConfig.originHealthTimeout()
        );

        Redis redis = Redis.createClient(vertx, new RedisOptions()
                .setConnectionString(engineConfig.redisUrl())
                .setNetClientOptions(new NetClientOptions().setConnectTimeout(REDIS_CONNECT_TIMEOUT_MS)));
        remoteCache = new RedisConfigCacheAdapter(vertx, redis, engineConfig.redisUrl(), engineConfig.redisBackoff());

        // Application services (use cases)
        LocalConfigCache localCache = new LocalConfigCache(engineConfig.localCacheTtl(), clock);
        ConfigurationCache configurationCache = new ConfigurationCache(
                vertx,
                localCache,
                remoteCache,
                origin,
                metrics,
                engineConfig.remoteCacheTtl(),
                engineConfig.redisCommandTimeout()
        );

        validationUseCase = new RuleEvaluator(
                configurationCache,
                new FraudHeuristics(clock),
                metrics,
                clock,
                engineConfig.rejectWhenUnconfigured()
        );
        healthCheckUseCase = new HealthProbe(origin, remoteCache, localCache, clock);

        log.info("Services wired up (Hexagonal Architecture)");
    }

    // The engine runs without the remote tier when Redis is down
    private Future<Void> connectRemoteCache() {
        return remoteCache.connect()
                .recover(error -> {
                    log.warn("Continuing without remote cache: {}", error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        // Input adapters (handlers)
        WebRouter webRouter = new WebRouter(
                router,
                new CpaValidationHandler(validationUseCase, new CpaRequestValidator()),
                new ActiveRulesHandler(validationUseCase),
                new CpaScenarioHandler(validationUseCase, clock),
                new HealthHandler(healthCheckUseCase, WebRouter.SERVICE_NAME, WebRouter.VERSION),
                new ServiceStatusHandler(WebRouter.SERVICE_NAME, clock),
                new MetricsHandler(meterRegistry)
        );
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = engineConfig.httpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
