package com.fature.cpa.domain.service;

import com.fature.cpa.domain.model.FraudVerdict;
import com.fature.cpa.domain.model.ValidationInput;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FraudHeuristics
 */
class FraudHeuristicsTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final FraudHeuristics heuristics = new FraudHeuristics(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void detect_highDepositWithFewBets() {
        FraudVerdict verdict = heuristics.detect(input("2000", 3, "100", NOW.minus(Duration.ofDays(10))));

        assertTrue(verdict.suspicious());
        assertTrue(verdict.matchedPatterns().contains("High deposit (>1000) with few bets (<5)"));
        assertTrue(verdict.message().startsWith("FRAUD DETECTED: "));
    }

    @Test
    void detect_ordinaryActivityIsClean() {
        FraudVerdict verdict = heuristics.detect(input("100", 20, "50", NOW.minus(Duration.ofDays(10))));

        assertFalse(verdict.suspicious());
        assertTrue(verdict.matchedPatterns().isEmpty());
        assertEquals("No suspicious pattern detected", verdict.message());
    }

    @Test
    void detect_stronglyNegativeGgr() {
        FraudVerdict verdict = heuristics.detect(input("100", 20, "-600", NOW.minus(Duration.ofDays(10))));

        assertEquals(1, verdict.matchedPatterns().size());
        assertTrue(verdict.matchedPatterns().get(0).startsWith("Strongly negative GGR"));
    }

    @Test
    void detect_veryActiveNewAccount() {
        FraudVerdict verdict = heuristics.detect(input("100", 60, "10", NOW.minus(Duration.ofHours(3))));

        assertEquals(1, verdict.matchedPatterns().size());
        assertTrue(verdict.matchedPatterns().get(0).startsWith("Very high activity (60 bets)"));
    }

    @Test
    void detect_accountOlderThanOneDayIsNotNew() {
        FraudVerdict verdict = heuristics.detect(input("100", 60, "10", NOW.minus(Duration.ofHours(25))));

        assertFalse(verdict.suspicious());
    }

    @Test
    void detect_averageStakeTooHigh() {
        FraudVerdict verdict = heuristics.detect(input("1000", 4, "0", NOW.minus(Duration.ofDays(10))));

        assertEquals(1, verdict.matchedPatterns().size());
        assertEquals("Average stake per bet too high (250.00)", verdict.matchedPatterns().get(0));
    }

    @Test
    void detect_averageStakeJustAboveLimitIsFlagged() {
        // 600.01 / 3 = 200.0033..., which rounds to 200.00
        FraudVerdict verdict = heuristics.detect(input("600.01", 3, "0", NOW.minus(Duration.ofDays(10))));

        assertTrue(verdict.suspicious());
        assertEquals(List.of("Average stake per bet too high (200.00)"), verdict.matchedPatterns());
    }

    @Test
    void detect_averageStakeExactlyAtLimitIsClean() {
        FraudVerdict verdict = heuristics.detect(input("600", 3, "0", NOW.minus(Duration.ofDays(10))));

        assertFalse(verdict.suspicious());
    }

    @Test
    void detect_ggrTooHighComparedToDeposit() {
        FraudVerdict verdict = heuristics.detect(input("100", 20, "300", NOW.minus(Duration.ofDays(10))));

        assertEquals(1, verdict.matchedPatterns().size());
        assertEquals("GGR too high compared to deposit (300.0%)", verdict.matchedPatterns().get(0));
    }

    @Test
    void detect_zeroDepositAndZeroBetsDoesNotFail() {
        FraudVerdict verdict = heuristics.detect(input("0", 0, "10", NOW.minus(Duration.ofDays(10))));

        assertEquals(1, verdict.matchedPatterns().size());
        assertEquals("GGR too high compared to deposit (no deposit)", verdict.matchedPatterns().get(0));
    }

    @Test
    void detect_internalFaultYieldsCleanVerdict() {
        ValidationInput incomplete = ValidationInput.builder()
                .affiliateId("aff-1")
                .userId("user-1")
                .betCount(3)
                .build();

        FraudVerdict verdict = assertDoesNotThrow(() -> heuristics.detect(incomplete));

        assertFalse(verdict.suspicious());
    }

    private static ValidationInput input(String deposit, long bets, String ggr, Instant registeredAt) {
        return ValidationInput.builder()
                .affiliateId("aff-1")
                .userId("user-1")
                .depositAmount(new BigDecimal(deposit))
                .betCount(bets)
                .ggrAmount(new BigDecimal(ggr))
                .registrationDate(registeredAt)
                .build();
    }
}
