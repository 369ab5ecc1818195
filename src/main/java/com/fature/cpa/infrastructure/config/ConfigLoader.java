package com.fature.cpa.infrastructure.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads application.yml from the classpath and overlays the deployment environment variables
 */
@Slf4j
public final class ConfigLoader {

    static final String CONFIG_FILE = "application.yml";

    private ConfigLoader() {
    }

    public static Future<JsonObject> load(Vertx vertx) {
        ConfigStoreOptions yamlStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", CONFIG_FILE));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
                .setType("env")
                .setConfig(new JsonObject()
                        .put("raw-data", true)
                        .put("keys", new JsonArray()
                                .add("PORT")
                                .add("CONFIG_SERVICE_URL")
                                .add("REDIS_URL")
                                .add("CACHE_TTL")));

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .setScanPeriod(0)
                .addStore(yamlStore)
                .addStore(envStore));

        return retriever.getConfig()
                .onSuccess(config -> log.info("Loaded configuration from {}", CONFIG_FILE))
                .onFailure(error -> log.error("Failed to load {}: {}", CONFIG_FILE, error.getMessage()))
                .onComplete(ar -> retriever.close());
    }
}
