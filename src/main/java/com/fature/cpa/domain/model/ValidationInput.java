package com.fature.cpa.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Activity of one referred user, evaluated against the CPA criteria.
 * Field presence and types are checked by the web layer before this is built.
 */
@Builder
public record ValidationInput(
        String affiliateId,
        String userId,
        BigDecimal depositAmount,
        long betCount,
        BigDecimal ggrAmount,
        Instant registrationDate,
        ValidationOption validationOption
) {
    public ValidationInput {
        if (validationOption == null) {
            validationOption = ValidationOption.DEFAULT;
        }
    }
}
