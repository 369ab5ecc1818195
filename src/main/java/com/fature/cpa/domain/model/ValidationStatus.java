package com.fature.cpa.domain.model;

/**
 * Final verdict of a CPA validation
 */
public enum ValidationStatus {
    APPROVED("approved"),
    REJECTED("rejected"),
    ERROR("error");

    private final String value;

    ValidationStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
