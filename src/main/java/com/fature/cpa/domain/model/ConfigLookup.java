package com.fature.cpa.domain.model;

import java.util.Optional;

/**
 * Outcome of resolving a configuration key against one tier.
 * Distinguishes "no such key" from "could not reach the store".
 */
public final class ConfigLookup {

    private enum Kind {
        PRESENT,
        ABSENT,
        FAULT
    }

    private static final ConfigLookup ABSENT = new ConfigLookup(Kind.ABSENT, null, null);

    private final Kind kind;
    private final ConfigValue value;
    private final Throwable cause;

    private ConfigLookup(Kind kind, ConfigValue value, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.cause = cause;
    }

    public static ConfigLookup present(ConfigValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Present lookup requires a value");
        }
        return new ConfigLookup(Kind.PRESENT, value, null);
    }

    public static ConfigLookup absent() {
        return ABSENT;
    }

    public static ConfigLookup fault(Throwable cause) {
        return new ConfigLookup(Kind.FAULT, null, cause);
    }

    public boolean isPresent() {
        return kind == Kind.PRESENT;
    }

    public boolean isFault() {
        return kind == Kind.FAULT;
    }

    public Optional<ConfigValue> value() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        switch (kind) {
            case PRESENT:
                return "present(" + value + ")";
            case FAULT:
                return "fault(" + (cause != null ? cause.getMessage() : "unknown") + ")";
            default:
                return "absent";
        }
    }
}
