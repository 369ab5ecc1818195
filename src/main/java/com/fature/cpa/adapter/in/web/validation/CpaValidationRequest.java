package com.fature.cpa.adapter.in.web.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO for an incoming CPA validation request
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CpaValidationRequest(
        String affiliateId,
        String userId,
        BigDecimal depositAmount,
        BigDecimal betCount,
        BigDecimal ggrAmount,
        String registrationDate,
        String validationOption
) {
    @JsonCreator
    public CpaValidationRequest(
            @JsonProperty("affiliateId") String affiliateId,
            @JsonProperty("userId") String userId,
            @JsonProperty("depositAmount") BigDecimal depositAmount,
            @JsonProperty("betCount") BigDecimal betCount,
            @JsonProperty("ggrAmount") BigDecimal ggrAmount,
            @JsonProperty("registrationDate") String registrationDate,
            @JsonProperty("validationOption") String validationOption
    ) {
        this.affiliateId = affiliateId;
        this.userId = userId;
        this.depositAmount = depositAmount;
        this.betCount = betCount;
        this.ggrAmount = ggrAmount;
        this.registrationDate = registrationDate;
        this.validationOption = validationOption;
    }
}
