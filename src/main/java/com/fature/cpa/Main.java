package com.fature.cpa;

import com.fature.cpa.adapter.in.web.HttpServerVerticle;
import com.fature.cpa.infrastructure.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting CPA Rules Engine...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        ConfigLoader.load(vertx)
                .compose(config -> vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1)))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down CPA Rules Engine...");
                        vertx.close();
                    }));

                    log.info("CPA Rules Engine is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start CPA Rules Engine", error);
                    vertx.close();
                });
    }
}
