package com.fature.cpa.domain.service;

import com.fature.cpa.domain.model.FraudVerdict;
import com.fature.cpa.domain.model.ValidationInput;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless detector of suspicious activity patterns.
 * Thresholds are fixed; they are not read from the configuration origin.
 */
@Slf4j
public class FraudHeuristics {

    static final BigDecimal HIGH_DEPOSIT = new BigDecimal("1000");
    static final long LOW_BET_COUNT = 5;
    static final BigDecimal NEGATIVE_GGR_LIMIT = new BigDecimal("-500");
    static final long NEW_ACCOUNT_BET_COUNT = 50;
    static final BigDecimal MAX_AVERAGE_STAKE = new BigDecimal("200");
    static final BigDecimal GGR_TO_DEPOSIT_RATIO = new BigDecimal("2");

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    private final Clock clock;

    public FraudHeuristics(Clock clock) {
        this.clock = clock;
    }

    /**
     * Run all pattern checks. Never throws: an internal fault yields a clean verdict.
     */
    public FraudVerdict detect(ValidationInput input) {
        try {
            return FraudVerdict.of(matchPatterns(input));
        } catch (RuntimeException e) {
            log.error("Fraud detection failed for user {}, treating as not suspicious",
                    input != null ? input.userId() : null, e);
            return FraudVerdict.clean();
        }
    }

    private List<String> matchPatterns(ValidationInput input) {
        List<String> patterns = new ArrayList<>();
        BigDecimal deposit = input.depositAmount();
        BigDecimal ggr = input.ggrAmount();
        long bets = input.betCount();

        if (deposit.compareTo(HIGH_DEPOSIT) > 0 && bets < LOW_BET_COUNT) {
            patterns.add("High deposit (>1000) with few bets (<5)");
        }

        if (ggr.compareTo(NEGATIVE_GGR_LIMIT) < 0) {
            patterns.add("Strongly negative GGR (" + ggr.toPlainString() + ")");
        }

        long daysSinceRegistration = daysSince(input);
        if (daysSinceRegistration < 1 && bets > NEW_ACCOUNT_BET_COUNT) {
            patterns.add("Very high activity (" + bets + " bets) for new account ("
                    + daysSinceRegistration + " days)");
        }

        // average = deposit / bets, compared without rounding
        if (bets > 0 && deposit.compareTo(MAX_AVERAGE_STAKE.multiply(BigDecimal.valueOf(bets))) > 0) {
            BigDecimal averageStake = deposit.divide(BigDecimal.valueOf(bets), 2, RoundingMode.HALF_UP);
            patterns.add("Average stake per bet too high (" + averageStake.toPlainString() + ")");
        }

        if (ggr.compareTo(deposit.multiply(GGR_TO_DEPOSIT_RATIO)) > 0) {
            patterns.add("GGR too high compared to deposit (" + ratioDescription(ggr, deposit) + ")");
        }

        return patterns;
    }

    private long daysSince(ValidationInput input) {
        long elapsed = clock.millis() - input.registrationDate().toEpochMilli();
        return Math.floorDiv(elapsed, MILLIS_PER_DAY);
    }

    private String ratioDescription(BigDecimal ggr, BigDecimal deposit) {
        if (deposit.signum() == 0) {
            return "no deposit";
        }
        return ggr.multiply(BigDecimal.valueOf(100))
                .divide(deposit, 1, RoundingMode.HALF_UP)
                .toPlainString() + "%";
    }
}
