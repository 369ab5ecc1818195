package com.fature.cpa.adapter.in.web.validation;

import com.fature.cpa.domain.model.ActiveRules;
import com.fature.cpa.domain.model.RuleOutcome;
import com.fature.cpa.domain.model.ValidationResult;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.LinkedHashMap;

/**
 * JSON shapes returned by the CPA endpoints
 */
public final class ValidationResponseMapper {

    private ValidationResponseMapper() {
    }

    public static JsonObject toJson(ValidationResult result) {
        JsonArray individualResults = new JsonArray();
        JsonArray rulesApplied = new JsonArray();
        for (RuleOutcome outcome : result.outcomes()) {
            individualResults.add(new JsonObject()
                    .put("criterion", outcome.criterion().name())
                    .put("rule", outcome.description())
                    .put("result", outcome.label()));
            rulesApplied.add(outcome.description());
        }

        JsonObject details = new JsonObject()
                .put("affiliateId", result.affiliateId())
                .put("userId", result.userId())
                .put("validationOption", result.validationOption().getValue())
                .put("configsUsed", new JsonObject(new LinkedHashMap<>(result.configsUsed())))
                .put("individualResults", individualResults)
                .put("processingTimeMs", result.processingTimeMs());
        if (result.error() != null) {
            details.put("error", result.error());
        }

        return new JsonObject()
                .put("validationId", result.validationId())
                .put("result", result.status().getValue())
                .put("reason", result.reason())
                .put("details", details)
                .put("timestamp", result.timestamp().toString())
                .put("rulesApplied", rulesApplied);
    }

    public static JsonObject toJson(ActiveRules rules) {
        return new JsonObject()
                .put("validationOption", rules.validationOption().getValue())
                .put("rules", new JsonObject(new LinkedHashMap<>(rules.rules())))
                .put("timestamp", rules.timestamp().toString());
    }

    public static JsonObject success(String message, JsonObject data) {
        return new JsonObject()
                .put("status", "success")
                .put("message", message)
                .put("data", data);
    }

    public static JsonObject error(String message) {
        return new JsonObject()
                .put("status", "error")
                .put("message", message);
    }
}
