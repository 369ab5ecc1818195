package com.fature.cpa.infrastructure.config;

import com.fature.cpa.application.service.BackoffPolicy;
import io.vertx.core.json.JsonObject;
import lombok.Builder;

import java.time.Duration;

/**
 * Typed view of application.yml, with the deployment environment variables
 * PORT, CONFIG_SERVICE_URL, REDIS_URL and CACHE_TTL (milliseconds) taking precedence.
 */
@Builder
public record EngineConfig(
        int httpPort,
        String originUrl,
        String originConfigurationsPath,
        Duration originTimeout,
        Duration originHealthTimeout,
        String redisUrl,
        Duration redisCommandTimeout,
        BackoffPolicy redisBackoff,
        Duration localCacheTtl,
        Duration remoteCacheTtl,
        boolean rejectWhenUnconfigured
) {

    public static final int DEFAULT_PORT = 3000;
    public static final String DEFAULT_ORIGIN_URL = "http://config-service.fature.svc.cluster.local:5000";
    public static final String DEFAULT_CONFIGURATIONS_PATH = "/api/v1/configurations";
    public static final String DEFAULT_REDIS_URL = "redis://redis.fature.svc.cluster.local:6379";

    public static EngineConfig fromJson(JsonObject json) {
        JsonObject http = section(json, "http");
        JsonObject origin = section(json, "origin");
        JsonObject redis = section(json, "redis");
        JsonObject backoff = section(redis, "backoff");
        JsonObject cache = section(json, "cache");
        JsonObject validation = section(json, "validation");

        Duration localTtl = json.containsKey("CACHE_TTL")
                ? Duration.ofMillis(asLong(json.getValue("CACHE_TTL"), "CACHE_TTL"))
                : Duration.ofSeconds(asLong(value(cache, "local-ttl-seconds", 300), "cache.local-ttl-seconds"));

        return EngineConfig.builder()
                .httpPort((int) asLong(value(json, "PORT", value(http, "port", DEFAULT_PORT)), "http.port"))
                .originUrl(json.getString("CONFIG_SERVICE_URL", origin.getString("url", DEFAULT_ORIGIN_URL)))
                .originConfigurationsPath(origin.getString("configurations-path", DEFAULT_CONFIGURATIONS_PATH))
                .originTimeout(Duration.ofMillis(asLong(value(origin, "timeout-ms", 5000), "origin.timeout-ms")))
                .originHealthTimeout(Duration.ofMillis(
                        asLong(value(origin, "health-timeout-ms", 3000), "origin.health-timeout-ms")))
                .redisUrl(json.getString("REDIS_URL", redis.getString("url", DEFAULT_REDIS_URL)))
                .redisCommandTimeout(Duration.ofMillis(
                        asLong(value(redis, "command-timeout-ms", 1000), "redis.command-timeout-ms")))
                .redisBackoff(new BackoffPolicy(
                        Duration.ofMillis(asLong(value(backoff, "step-ms", 100), "redis.backoff.step-ms")),
                        Duration.ofMillis(asLong(value(backoff, "max-delay-ms", 3000), "redis.backoff.max-delay-ms")),
                        (int) asLong(value(backoff, "max-attempts", 10), "redis.backoff.max-attempts"),
                        Duration.ofMillis(asLong(value(backoff, "max-elapsed-ms", 3_600_000), "redis.backoff.max-elapsed-ms"))))
                .localCacheTtl(localTtl)
                .remoteCacheTtl(Duration.ofSeconds(
                        asLong(value(cache, "remote-ttl-seconds", 3600), "cache.remote-ttl-seconds")))
                .rejectWhenUnconfigured(validation.getBoolean("reject-when-unconfigured", false))
                .build();
    }

    private static Object value(JsonObject json, String key, Object defaultValue) {
        Object value = json.getValue(key);
        return value != null ? value : defaultValue;
    }

    private static JsonObject section(JsonObject parent, String name) {
        JsonObject section = parent.getJsonObject(name);
        return section != null ? section : new JsonObject();
    }

    // Environment values may arrive as text
    private static long asLong(Object value, String name) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration " + name + " must be a number, got: " + value, e);
        }
    }
}
