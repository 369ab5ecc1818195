package com.fature.cpa.application.service;

import com.fature.cpa.application.port.in.CpaValidationUseCase;
import com.fature.cpa.application.port.out.ValidationMetrics;
import com.fature.cpa.domain.model.ActiveRules;
import com.fature.cpa.domain.model.ConfigKey;
import com.fature.cpa.domain.model.ConfigValue;
import com.fature.cpa.domain.model.Criterion;
import com.fature.cpa.domain.model.FraudVerdict;
import com.fature.cpa.domain.model.RuleOutcome;
import com.fature.cpa.domain.model.ValidationInput;
import com.fature.cpa.domain.model.ValidationOption;
import com.fature.cpa.domain.model.ValidationResult;
import com.fature.cpa.domain.model.ValidationStatus;
import com.fature.cpa.domain.service.FraudHeuristics;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application service implementing CPA validation.
 * <p>
 * Per call: resolve the option's configuration through the {@link ConfigurationCache},
 * evaluate each criterion whose configuration is present, run the fraud heuristics
 * when enabled, and approve only if every evaluated criterion passed. Criteria without
 * configuration are left out of the vote. Any unexpected fault produces a result with
 * status ERROR instead of a failed future.
 */
@Slf4j
public class RuleEvaluator implements CpaValidationUseCase {

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    private final ConfigurationCache configurationCache;
    private final FraudHeuristics fraudHeuristics;
    private final ValidationMetrics metrics;
    private final Clock clock;
    private final boolean rejectWhenUnconfigured;

    public RuleEvaluator(
            ConfigurationCache configurationCache,
            FraudHeuristics fraudHeuristics,
            ValidationMetrics metrics,
            Clock clock,
            boolean rejectWhenUnconfigured
    ) {
        this.configurationCache = configurationCache;
        this.fraudHeuristics = fraudHeuristics;
        this.metrics = metrics;
        this.clock = clock;
        this.rejectWhenUnconfigured = rejectWhenUnconfigured;
    }

    /**
     * Pipeline stages of one validation call
     */
    enum Stage {
        START,
        CONFIGS_LOADED,
        RULES_EVALUATED,
        FRAUD_CHECKED,
        AGGREGATED,
        DONE,
        ERROR
    }

    @Override
    public Future<ValidationResult> validate(ValidationInput input) {
        ValidationRun run = new ValidationRun(input, clock.millis());
        log.info("Starting CPA validation {} for affiliate {}", run.validationId, input.affiliateId());

        Future<ValidationResult> pipeline;
        try {
            pipeline = loadConfigs(requiredKeys(input.validationOption()))
                    .map(configs -> evaluate(run, configs));
        } catch (RuntimeException e) {
            pipeline = Future.failedFuture(e);
        }
        return pipeline.otherwise(error -> errorResult(run, error));
    }

    @Override
    public Future<ActiveRules> getActiveRules(ValidationOption option) {
        return loadConfigs(requiredKeys(option))
                .map(configs -> new ActiveRules(option, toRawValues(configs), clock.instant()));
    }

    /**
     * Keys resolved for an option, in resolution order
     */
    static List<ConfigKey> requiredKeys(ValidationOption option) {
        return List.of(
                ConfigKey.minimumDeposit(option),
                ConfigKey.minimumBets(option),
                ConfigKey.minimumGgr(option),
                ConfigKey.eligibilityWindowDays(),
                ConfigKey.timezone(),
                ConfigKey.fraudDetectionEnabled()
        );
    }

    // Sequential resolution; absent keys map to null
    private Future<Map<ConfigKey, ConfigValue>> loadConfigs(List<ConfigKey> keys) {
        Future<Map<ConfigKey, ConfigValue>> future = Future.succeededFuture(new LinkedHashMap<>());
        for (ConfigKey key : keys) {
            future = future.compose(resolved -> configurationCache.get(key).map(value -> {
                resolved.put(key, value.orElse(null));
                return resolved;
            }));
        }
        return future;
    }

    private ValidationResult evaluate(ValidationRun run, Map<ConfigKey, ConfigValue> configs) {
        run.advance(Stage.CONFIGS_LOADED);
        ValidationInput input = run.input;
        ValidationOption option = input.validationOption();
        log.debug("Configuration loaded for {}: {}", run.validationId, configs);

        List<RuleOutcome> outcomes = new ArrayList<>();
        threshold(Criterion.DEPOSIT, "Deposit", input.depositAmount(),
                configs.get(ConfigKey.minimumDeposit(option))).ifPresent(outcomes::add);
        threshold(Criterion.BET_COUNT, "Bets", BigDecimal.valueOf(input.betCount()),
                configs.get(ConfigKey.minimumBets(option))).ifPresent(outcomes::add);
        threshold(Criterion.GGR, "GGR", input.ggrAmount(),
                configs.get(ConfigKey.minimumGgr(option))).ifPresent(outcomes::add);
        eligibilityWindow(input, configs.get(ConfigKey.eligibilityWindowDays())).ifPresent(outcomes::add);
        run.advance(Stage.RULES_EVALUATED);

        ConfigValue fraudToggle = configs.get(ConfigKey.fraudDetectionEnabled());
        if (fraudToggle != null && fraudToggle.isTrue()) {
            FraudVerdict verdict = fraudHeuristics.detect(input);
            outcomes.add(RuleOutcome.of(Criterion.FRAUD, !verdict.suspicious(), verdict.message()));
        }
        run.advance(Stage.FRAUD_CHECKED);

        outcomes.forEach(outcome -> log.info("{} - {} validation: {}",
                run.validationId, outcome.criterion(), outcome.description()));

        ValidationStatus status;
        String reason;
        if (outcomes.isEmpty()) {
            log.warn("Validation {} has no configured criteria ({})", run.validationId,
                    rejectWhenUnconfigured ? "rejecting" : "approving by default");
            status = rejectWhenUnconfigured ? ValidationStatus.REJECTED : ValidationStatus.APPROVED;
            reason = "No validation criteria configured";
        } else if (outcomes.stream().allMatch(RuleOutcome::passed)) {
            status = ValidationStatus.APPROVED;
            reason = "All validations approved";
        } else {
            status = ValidationStatus.REJECTED;
            reason = "One or more validations failed";
        }
        run.advance(Stage.AGGREGATED);

        long elapsed = run.elapsedMillis();
        metrics.countValidation(status, option, input.affiliateId());
        metrics.recordDuration(option, Duration.ofMillis(elapsed));

        ValidationResult result = ValidationResult.builder()
                .validationId(run.validationId)
                .status(status)
                .reason(reason)
                .affiliateId(input.affiliateId())
                .userId(input.userId())
                .validationOption(option)
                .configsUsed(toRawValues(configs))
                .outcomes(outcomes)
                .processingTimeMs(elapsed)
                .timestamp(clock.instant())
                .build();

        run.advance(Stage.DONE);
        log.info("Validation {} completed: {}", run.validationId, status.getValue().toUpperCase());
        return result;
    }

    private Optional<RuleOutcome> threshold(Criterion criterion, String label, BigDecimal actual, ConfigValue minimum) {
        if (minimum == null) {
            return Optional.empty();
        }
        Optional<BigDecimal> limit = minimum.asNumber();
        if (limit.isEmpty()) {
            return Optional.of(RuleOutcome.of(criterion, false,
                    label + " " + actual.toPlainString() + " has non-numeric minimum '" + minimum + "' (REJECTED)"));
        }
        boolean passed = actual.compareTo(limit.get()) >= 0;
        return Optional.of(RuleOutcome.of(criterion, passed, String.format("%s %s %s %s (%s)",
                label, actual.toPlainString(), passed ? ">=" : "<", minimum, passed ? "APPROVED" : "REJECTED")));
    }

    private Optional<RuleOutcome> eligibilityWindow(ValidationInput input, ConfigValue maxDays) {
        if (maxDays == null) {
            return Optional.empty();
        }
        long days = Math.floorDiv(clock.millis() - input.registrationDate().toEpochMilli(), MILLIS_PER_DAY);
        Optional<BigDecimal> limit = maxDays.asNumber();
        if (limit.isEmpty()) {
            return Optional.of(RuleOutcome.of(Criterion.ELIGIBILITY_WINDOW, false,
                    "Window " + days + " days has non-numeric limit '" + maxDays + "' (REJECTED)"));
        }
        boolean passed = BigDecimal.valueOf(days).compareTo(limit.get()) <= 0;
        return Optional.of(RuleOutcome.of(Criterion.ELIGIBILITY_WINDOW, passed, String.format("Window %d days %s %s days (%s)",
                days, passed ? "<=" : ">", maxDays, passed ? "APPROVED" : "REJECTED")));
    }

    private ValidationResult errorResult(ValidationRun run, Throwable error) {
        Stage failedAt = run.stage;
        run.advance(Stage.ERROR);
        log.error("Validation {} failed after stage {}", run.validationId, failedAt, error);

        ValidationInput input = run.input;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        try {
            metrics.countValidation(ValidationStatus.ERROR, input.validationOption(), input.affiliateId());
        } catch (RuntimeException e) {
            log.warn("Failed to record error metric for {}: {}", run.validationId, e.getMessage());
        }

        return ValidationResult.builder()
                .validationId(run.validationId)
                .status(ValidationStatus.ERROR)
                .reason("Error during validation: " + message)
                .affiliateId(input.affiliateId())
                .userId(input.userId())
                .validationOption(input.validationOption())
                .processingTimeMs(run.elapsedMillis())
                .timestamp(clock.instant())
                .error(message)
                .build();
    }

    private static Map<String, Object> toRawValues(Map<ConfigKey, ConfigValue> configs) {
        Map<String, Object> raw = new LinkedHashMap<>();
        configs.forEach((key, value) -> raw.put(key.value(), value != null ? value.raw() : null));
        return raw;
    }

    /**
     * State of one validate() call
     */
    private final class ValidationRun {
        private final ValidationInput input;
        private final long startedAt;
        private final String validationId;
        private Stage stage = Stage.START;

        private ValidationRun(ValidationInput input, long startedAt) {
            this.input = input;
            this.startedAt = startedAt;
            this.validationId = input.affiliateId() + "_" + input.userId() + "_" + startedAt;
        }

        private void advance(Stage next) {
            log.trace("{}: {} -> {}", validationId, stage, next);
            stage = next;
        }

        private long elapsedMillis() {
            return clock.millis() - startedAt;
        }
    }
}
