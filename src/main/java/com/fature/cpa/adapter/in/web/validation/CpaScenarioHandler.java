package com.fature.cpa.adapter.in.web.validation;

import com.fature.cpa.application.port.in.CpaValidationUseCase;
import com.fature.cpa.domain.model.ValidationInput;
import com.fature.cpa.domain.model.ValidationOption;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs fixed sample inputs through the engine so operators can check a deployment end to end
 * Handles POST /api/v1/integration-service/test-cpa
 */
@Slf4j
@RequiredArgsConstructor
public class CpaScenarioHandler implements Handler<RoutingContext> {

    private final CpaValidationUseCase validationUseCase;
    private final Clock clock;

    /**
     * Named sample input
     */
    record Scenario(String name, ValidationInput input) {
    }

    @Override
    public void handle(RoutingContext context) {
        List<Scenario> scenarios = scenarios(clock.instant());
        JsonArray results = new JsonArray();

        Future<Void> chain = Future.succeededFuture();
        for (Scenario scenario : scenarios) {
            chain = chain.compose(v -> run(scenario).map(result -> {
                results.add(result);
                return null;
            }));
        }

        chain.onSuccess(v -> context.response()
                        .putHeader("Content-Type", "application/json")
                        .end(ValidationResponseMapper.success("CPA validation scenarios executed", new JsonObject()
                                .put("total_scenarios", scenarios.size())
                                .put("results", results)
                                .put("timestamp", clock.instant().toString())).encode()))
                .onFailure(error -> {
                    log.error("CPA scenario run failed", error);
                    context.response()
                            .setStatusCode(500)
                            .putHeader("Content-Type", "application/json")
                            .end(ValidationResponseMapper.error("Failed to run CPA scenarios")
                                    .put("error", error.getMessage())
                                    .encode());
                });
    }

    static List<Scenario> scenarios(Instant now) {
        return List.of(
                new Scenario("Approved", sample("TEST_AFF_001", "TEST_USER_001",
                        "100.0", 20, "50.0", now.minus(Duration.ofDays(5)))),
                new Scenario("Rejected - low deposit", sample("TEST_AFF_002", "TEST_USER_002",
                        "10.0", 5, "5.0", now.minus(Duration.ofDays(2)))),
                new Scenario("Fraud - high deposit, few bets", sample("TEST_AFF_003", "TEST_USER_003",
                        "2000.0", 3, "100.0", now.minus(Duration.ofDays(1))))
        );
    }

    // A failing scenario is reported in place; the others still run
    private Future<JsonObject> run(Scenario scenario) {
        JsonObject entry = new JsonObject()
                .put("scenario", scenario.name())
                .put("input", toJson(scenario.input()));
        Future<JsonObject> outcome;
        try {
            outcome = validationUseCase.validate(scenario.input())
                    .map(result -> entry.put("result", ValidationResponseMapper.toJson(result)));
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        return outcome.otherwise(error -> {
            log.warn("Scenario '{}' failed: {}", scenario.name(), error.getMessage());
            return entry.put("error", error.getMessage());
        });
    }

    private static ValidationInput sample(String affiliateId, String userId, String deposit, long bets,
                                          String ggr, Instant registeredAt) {
        return ValidationInput.builder()
                .affiliateId(affiliateId)
                .userId(userId)
                .depositAmount(new BigDecimal(deposit))
                .betCount(bets)
                .ggrAmount(new BigDecimal(ggr))
                .registrationDate(registeredAt)
                .validationOption(ValidationOption.OPCAO1)
                .build();
    }

    private static JsonObject toJson(ValidationInput input) {
        return new JsonObject()
                .put("affiliateId", input.affiliateId())
                .put("userId", input.userId())
                .put("depositAmount", input.depositAmount().toPlainString())
                .put("betCount", input.betCount())
                .put("ggrAmount", input.ggrAmount().toPlainString())
                .put("registrationDate", input.registrationDate().toString())
                .put("validationOption", input.validationOption().getValue());
    }
}
