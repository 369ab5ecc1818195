package com.fature.cpa.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one CPA validation call. Immutable once returned.
 * configsUsed keeps insertion order and maps unresolved keys to null.
 */
@Builder
public record ValidationResult(
        String validationId,
        ValidationStatus status,
        String reason,
        String affiliateId,
        String userId,
        ValidationOption validationOption,
        Map<String, Object> configsUsed,
        List<RuleOutcome> outcomes,
        long processingTimeMs,
        Instant timestamp,
        String error
) {
    public ValidationResult {
        configsUsed = configsUsed == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configsUsed));
        outcomes = outcomes == null ? Collections.emptyList() : List.copyOf(outcomes);
    }
}
