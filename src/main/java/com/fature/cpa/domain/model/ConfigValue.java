package com.fature.cpa.domain.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Typed configuration value - one of Float, Integer, Boolean, Structured or String.
 * Produced by {@link com.fature.cpa.domain.service.ConfigValueCodec}; never null.
 */
public interface ConfigValue {

    /**
     * Plain Java value (Double, Long, Boolean, JsonObject/JsonArray, String)
     */
    Object raw();

    /**
     * Numeric view used by threshold criteria. Strings holding a number are accepted.
     */
    default Optional<BigDecimal> asNumber() {
        return Optional.empty();
    }

    /**
     * Only boolean true (or the text "true") enables a toggle
     */
    default boolean isTrue() {
        return false;
    }

    record FloatValue(double value) implements ConfigValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<BigDecimal> asNumber() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(value));
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record IntegerValue(long value) implements ConfigValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<BigDecimal> asNumber() {
            return Optional.of(BigDecimal.valueOf(value));
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record BooleanValue(boolean value) implements ConfigValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public boolean isTrue() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * JSON tree - a JsonObject or a JsonArray
     */
    record StructuredValue(Object tree) implements ConfigValue {
        public StructuredValue {
            if (!(tree instanceof JsonObject) && !(tree instanceof JsonArray)) {
                throw new IllegalArgumentException("Structured value must be a JSON object or array");
            }
        }

        @Override
        public Object raw() {
            return tree;
        }

        @Override
        public String toString() {
            return tree.toString();
        }
    }

    record StringValue(String value) implements ConfigValue {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String value must not be null");
            }
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<BigDecimal> asNumber() {
            try {
                return Optional.of(new BigDecimal(value.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        @Override
        public boolean isTrue() {
            return "true".equalsIgnoreCase(value.trim());
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
