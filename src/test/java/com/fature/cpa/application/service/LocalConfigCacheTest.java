package com.fature.cpa.application.service;

import com.fature.cpa.MutableClock;
import com.fature.cpa.domain.model.ConfigValue.IntegerValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LocalConfigCacheTest {

    private MutableClock clock;
    private LocalConfigCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new LocalConfigCache(Duration.ofMinutes(5), clock);
    }

    @Test
    void get_missingKey() {
        assertTrue(cache.get("cpa.validacao.prazo_dias").isEmpty());
    }

    @Test
    void get_freshEntry() {
        cache.put("cpa.validacao.prazo_dias", new IntegerValue(30));
        clock.advance(Duration.ofMinutes(4));

        assertEquals(new IntegerValue(30), cache.get("cpa.validacao.prazo_dias").orElseThrow());
    }

    @Test
    void get_expiredEntryIsAMissButStaysInMap() {
        cache.put("cpa.validacao.prazo_dias", new IntegerValue(30));
        clock.advance(Duration.ofMinutes(5).plusMillis(1));

        assertTrue(cache.get("cpa.validacao.prazo_dias").isEmpty());
        assertEquals(1, cache.size());
    }

    @Test
    void put_overwriteRefreshesTimestamp() {
        cache.put("k", new IntegerValue(1));
        clock.advance(Duration.ofMinutes(4));
        cache.put("k", new IntegerValue(2));
        clock.advance(Duration.ofMinutes(4));

        assertEquals(new IntegerValue(2), cache.get("k").orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void constructor_rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new LocalConfigCache(Duration.ZERO, clock));
        assertThrows(IllegalArgumentException.class, () -> new LocalConfigCache(Duration.ofSeconds(-1), clock));
    }
}
