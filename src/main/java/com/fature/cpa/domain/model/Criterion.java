package com.fature.cpa.domain.model;

/**
 * CPA criteria in evaluation order
 */
public enum Criterion {
    DEPOSIT,
    BET_COUNT,
    GGR,
    ELIGIBILITY_WINDOW,
    FRAUD
}
