package com.fature.cpa.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Value held by a single cache tier together with the moment it was fetched
 */
public record CacheEntry(ConfigValue value, Instant fetchedAt) {

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
