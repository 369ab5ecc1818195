package com.fature.cpa.application.port.out;

import io.vertx.core.Future;

import java.time.Duration;
import java.util.Optional;

/**
 * Output port for the shared, process-external TTL cache.
 * Transport problems surface as failed futures.
 */
public interface RemoteConfigCache {

    /**
     * @return the stored text, or empty when the key is not cached
     */
    Future<Optional<String>> get(String key);

    Future<Void> put(String key, String value, Duration ttl);

    Future<Void> ping();

    /**
     * False while the transport is disconnected or has given up reconnecting
     */
    boolean isAvailable();

    /**
     * Connection target, for diagnostics
     */
    String location();
}
