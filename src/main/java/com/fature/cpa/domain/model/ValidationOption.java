package com.fature.cpa.domain.model;

/**
 * CPA validation option - selects which option-scoped thresholds apply
 */
public enum ValidationOption {
    OPCAO1("opcao1"),
    OPCAO2("opcao2");

    public static final ValidationOption DEFAULT = OPCAO1;

    private final String value;

    ValidationOption(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ValidationOption fromValue(String value) {
        for (ValidationOption option : values()) {
            if (option.value.equalsIgnoreCase(value)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown validation option: " + value);
    }

    public static boolean isValid(String value) {
        for (ValidationOption option : values()) {
            if (option.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
