package com.fature.cpa.application.service;

import com.fature.cpa.domain.model.CacheEntry;
import com.fature.cpa.domain.model.ConfigValue;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process TTL tier. Expired entries count as misses and stay in the map
 * until overwritten; there is no eviction. Concurrent writes are last-write-wins.
 */
public class LocalConfigCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public LocalConfigCache(Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Local cache TTL must be positive, got: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<ConfigValue> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !entry.isFresh(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, ConfigValue value) {
        entries.put(key, new CacheEntry(value, clock.instant()));
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
