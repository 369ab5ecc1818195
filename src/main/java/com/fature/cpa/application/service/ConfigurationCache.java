package com.fature.cpa.application.service;

import com.fature.cpa.application.port.out.ConfigurationOrigin;
import com.fature.cpa.application.port.out.ConfigurationOrigin.OriginConfiguration;
import com.fature.cpa.application.port.out.RemoteConfigCache;
import com.fature.cpa.application.port.out.ValidationMetrics;
import com.fature.cpa.application.port.out.ValidationMetrics.CacheHitType;
import com.fature.cpa.domain.model.ConfigKey;
import com.fature.cpa.domain.model.ConfigLookup;
import com.fature.cpa.domain.model.ConfigValue;
import com.fature.cpa.domain.service.ConfigValueCodec;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Cache-aside configuration lookup over three tiers:
 * <ol>
 *   <li>local in-process TTL cache</li>
 *   <li>shared remote cache (keys prefixed with {@value #REMOTE_KEY_PREFIX})</li>
 *   <li>configuration origin, the source of truth</li>
 * </ol>
 * The first hit wins and fills the tiers above it. Remote cache problems never fail
 * a lookup, and absent keys are not cached, so every miss goes back to the origin.
 * Remote calls are bounded by a command timeout; an unanswered read counts as a fault.
 */
@Slf4j
public class ConfigurationCache {

    public static final String REMOTE_KEY_PREFIX = "config_cache:";

    private final Vertx vertx;
    private final LocalConfigCache localCache;
    private final RemoteConfigCache remoteCache;
    private final ConfigurationOrigin origin;
    private final ValidationMetrics metrics;
    private final Duration remoteTtl;
    private final Duration remoteTimeout;

    public ConfigurationCache(
            Vertx vertx,
            LocalConfigCache localCache,
            RemoteConfigCache remoteCache,
            ConfigurationOrigin origin,
            ValidationMetrics metrics,
            Duration remoteTtl,
            Duration remoteTimeout
    ) {
        if (remoteTimeout.isNegative() || remoteTimeout.isZero()) {
            throw new IllegalArgumentException("Remote cache timeout must be positive, got: " + remoteTimeout);
        }
        this.vertx = vertx;
        this.localCache = localCache;
        this.remoteCache = remoteCache;
        this.origin = origin;
        this.metrics = metrics;
        this.remoteTtl = remoteTtl;
        this.remoteTimeout = remoteTimeout;
    }

    /**
     * Resolve a key to its value, or empty when no tier knows it
     */
    public Future<Optional<ConfigValue>> get(ConfigKey key) {
        return lookup(key).map(ConfigLookup::value);
    }

    /**
     * Resolve a key keeping the distinction between an absent key and an unreachable origin
     */
    public Future<ConfigLookup> lookup(ConfigKey key) {
        String name = key.value();

        Optional<ConfigValue> local = localCache.get(name);
        if (local.isPresent()) {
            metrics.countCacheLookup(name, CacheHitType.LOCAL);
            return Future.succeededFuture(ConfigLookup.present(local.get()));
        }

        return lookupRemote(name).compose(remote -> {
            if (remote.isPresent()) {
                ConfigValue value = remote.value().orElseThrow();
                localCache.put(name, value);
                metrics.countCacheLookup(name, CacheHitType.REMOTE);
                log.debug("Remote cache hit for {}", name);
                return Future.succeededFuture(remote);
            }
            return lookupOrigin(name);
        });
    }

    public LocalConfigCache localCache() {
        return localCache;
    }

    private Future<ConfigLookup> lookupRemote(String key) {
        if (!remoteCache.isAvailable()) {
            return Future.succeededFuture(ConfigLookup.absent());
        }

        return bounded(guard(() -> remoteCache.get(REMOTE_KEY_PREFIX + key)), "GET " + key)
                .map(text -> text
                        .map(ConfigValueCodec::decodeCached)
                        .map(ConfigLookup::present)
                        .orElse(ConfigLookup.absent()))
                .otherwise(error -> {
                    log.warn("Remote cache miss for {}: {}", key, error.getMessage());
                    return ConfigLookup.fault(error);
                });
    }

    private Future<ConfigLookup> lookupOrigin(String key) {
        return guard(() -> origin.fetch(key)).compose(
                answer -> {
                    if (!answer.success()) {
                        log.warn("Configuration {} not available from origin", key);
                        metrics.countCacheLookup(key, CacheHitType.ERROR);
                        return Future.succeededFuture(ConfigLookup.absent());
                    }
                    ConfigValue value = decode(answer);
                    localCache.put(key, value);
                    return storeRemote(key, value).map(v -> {
                        metrics.countCacheLookup(key, CacheHitType.ORIGIN);
                        return ConfigLookup.present(value);
                    });
                },
                error -> {
                    log.error("Failed to fetch configuration {}: {}", key, error.getMessage());
                    metrics.countCacheLookup(key, CacheHitType.ERROR);
                    return Future.succeededFuture(ConfigLookup.fault(error));
                });
    }

    private ConfigValue decode(OriginConfiguration answer) {
        return ConfigValueCodec.decode(answer.value(), answer.dataType());
    }

    private Future<Void> storeRemote(String key, ConfigValue value) {
        if (!remoteCache.isAvailable()) {
            return Future.succeededFuture();
        }
        return bounded(guard(() -> remoteCache.put(REMOTE_KEY_PREFIX + key, ConfigValueCodec.encodeForCache(value), remoteTtl)),
                "SETEX " + key)
                .recover(error -> {
                    log.warn("Failed to cache {} in remote cache: {}", key, error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private <T> Future<T> bounded(Future<T> call, String operation) {
        if (call.isComplete()) {
            return call;
        }
        Promise<T> promise = Promise.promise();
        long timerId = vertx.setTimer(remoteTimeout.toMillis(), id -> promise.tryFail(new TimeoutException(
                "Remote cache " + operation + " timed out after " + remoteTimeout.toMillis() + " ms")));
        call.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    // Adapters may throw before handing back a future
    private static <T> Future<T> guard(Supplier<Future<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
