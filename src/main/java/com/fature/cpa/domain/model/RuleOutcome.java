package com.fature.cpa.domain.model;

/**
 * Result of one evaluated criterion
 */
public record RuleOutcome(Criterion criterion, String description, boolean passed) {

    public static RuleOutcome of(Criterion criterion, boolean passed, String description) {
        return new RuleOutcome(criterion, description, passed);
    }

    public String label() {
        return passed ? "APPROVED" : "REJECTED";
    }
}
