package com.fature.cpa.adapter.out.redis;

import com.fature.cpa.application.port.out.RemoteConfigCache;
import com.fature.cpa.application.service.BackoffPolicy;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisAPI;
import io.vertx.redis.client.RedisConnection;
import io.vertx.redis.client.Response;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis adapter for the shared configuration cache.
 * Implements RemoteConfigCache output port
 * <p>
 * Holds one connection. When it drops, reconnection is scheduled according to the
 * {@link BackoffPolicy}; once the policy gives up the adapter stays unavailable
 * for the rest of the process lifetime.
 */
@Slf4j
public class RedisConfigCacheAdapter implements RemoteConfigCache {

    private final Vertx vertx;
    private final Redis redis;
    private final String location;
    private final BackoffPolicy backoffPolicy;

    private final AtomicBoolean connecting = new AtomicBoolean(false);
    private volatile RedisConnection connection;
    private volatile RedisAPI api;
    private volatile boolean exhausted;

    public RedisConfigCacheAdapter(Vertx vertx, Redis redis, String location, BackoffPolicy backoffPolicy) {
        this.vertx = vertx;
        this.redis = redis;
        this.location = location;
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * Open the connection. A failed first attempt starts the reconnect schedule.
     */
    public Future<Void> connect() {
        return openConnection()
                .onSuccess(conn -> log.info("Redis client connected to {}", location))
                .onFailure(error -> {
                    log.error("Redis connection to {} failed: {}", location, error.getMessage());
                    scheduleReconnect(1, System.currentTimeMillis());
                })
                .mapEmpty();
    }

    public void close() {
        RedisAPI current = api;
        api = null;
        connection = null;
        exhausted = true;
        if (current != null) {
            current.close();
        }
        log.info("Redis client closed");
    }

    @Override
    public Future<Optional<String>> get(String key) {
        RedisAPI current = api;
        if (current == null) {
            return Future.failedFuture("Redis not connected");
        }
        return current.get(key).map(response -> Optional.ofNullable(response).map(Response::toString));
    }

    @Override
    public Future<Void> put(String key, String value, Duration ttl) {
        RedisAPI current = api;
        if (current == null) {
            return Future.failedFuture("Redis not connected");
        }
        return current.setex(key, String.valueOf(ttl.getSeconds()), value).mapEmpty();
    }

    @Override
    public Future<Void> ping() {
        RedisAPI current = api;
        if (current == null) {
            return Future.failedFuture("Redis not connected");
        }
        return current.ping(List.of()).mapEmpty();
    }

    @Override
    public boolean isAvailable() {
        return api != null && !exhausted;
    }

    @Override
    public String location() {
        return location;
    }

    private Future<RedisConnection> openConnection() {
        if (!connecting.compareAndSet(false, true)) {
            return Future.failedFuture("Redis connection already in progress");
        }
        return redis.connect()
                .onSuccess(conn -> {
                    connection = conn;
                    api = RedisAPI.api(conn);
                    conn.exceptionHandler(error -> onConnectionLost(conn, error));
                    conn.endHandler(v -> onConnectionLost(conn, null));
                })
                .onComplete(ar -> connecting.set(false));
    }

    private void onConnectionLost(RedisConnection lost, Throwable error) {
        if (lost != connection || exhausted) {
            return;
        }
        log.error("Redis client error: {}", error != null ? error.getMessage() : "connection closed");
        connection = null;
        api = null;
        scheduleReconnect(1, System.currentTimeMillis());
    }

    private void scheduleReconnect(int attempt, long startedAt) {
        if (exhausted) {
            return;
        }
        Duration elapsed = Duration.ofMillis(System.currentTimeMillis() - startedAt);
        Optional<Duration> delay = backoffPolicy.nextDelay(attempt, elapsed);
        if (delay.isEmpty()) {
            exhausted = true;
            log.error("Giving up on Redis at {} after {} attempts; remote cache disabled", location, attempt - 1);
            return;
        }

        log.warn("Reconnecting to Redis in {} ms (attempt {})", delay.get().toMillis(), attempt);
        vertx.setTimer(Math.max(1, delay.get().toMillis()), id -> openConnection()
                .onSuccess(conn -> log.info("Redis client reconnected to {}", location))
                .onFailure(error -> scheduleReconnect(attempt + 1, startedAt)));
    }
}
