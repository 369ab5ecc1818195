package com.fature.cpa.domain.service;

import com.fature.cpa.domain.model.ConfigValue;
import com.fature.cpa.domain.model.ConfigValue.BooleanValue;
import com.fature.cpa.domain.model.ConfigValue.FloatValue;
import com.fature.cpa.domain.model.ConfigValue.IntegerValue;
import com.fature.cpa.domain.model.ConfigValue.StringValue;
import com.fature.cpa.domain.model.ConfigValue.StructuredValue;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Converts raw configuration text into typed {@link ConfigValue}s.
 * <p>
 * Decoding is total: whenever the text cannot be read as the declared type the raw
 * string is returned as a {@link StringValue}. No exception leaves this class.
 */
@Slf4j
public final class ConfigValueCodec {

    public static final String TYPE_FLOAT = "float";
    public static final String TYPE_INT = "int";
    public static final String TYPE_BOOL = "bool";
    public static final String TYPE_JSON = "json";

    private ConfigValueCodec() {
    }

    /**
     * Decode a value served by the configuration origin according to its data_type tag
     */
    public static ConfigValue decode(String raw, String dataType) {
        if (raw == null) {
            return new StringValue("");
        }
        if (dataType == null) {
            return new StringValue(raw);
        }

        try {
            switch (dataType.trim().toLowerCase()) {
                case TYPE_FLOAT:
                    double number = Double.parseDouble(raw.trim());
                    if (Double.isNaN(number) || Double.isInfinite(number)) {
                        return new StringValue(raw);
                    }
                    return new FloatValue(number);
                case TYPE_INT:
                    return new IntegerValue(Long.parseLong(raw.trim()));
                case TYPE_BOOL:
                    return new BooleanValue("true".equalsIgnoreCase(raw.trim()));
                case TYPE_JSON:
                    return fromJson(Json.decodeValue(raw), raw);
                default:
                    return new StringValue(raw);
            }
        } catch (NumberFormatException | DecodeException e) {
            log.debug("Value '{}' is not a valid {}, keeping raw string", raw, dataType);
            return new StringValue(raw);
        }
    }

    /**
     * Decode the text representation kept in the remote cache tier.
     * JSON-parsable text becomes the matching type, anything else stays a string.
     */
    public static ConfigValue decodeCached(String text) {
        if (text == null) {
            return new StringValue("");
        }
        try {
            return fromJson(Json.decodeValue(text), text);
        } catch (DecodeException e) {
            return new StringValue(text);
        }
    }

    /**
     * Text stored in the remote cache tier: structured values are JSON-encoded, scalars as plain text
     */
    public static String encodeForCache(ConfigValue value) {
        if (value instanceof StructuredValue) {
            Object tree = value.raw();
            return tree instanceof JsonObject ? ((JsonObject) tree).encode() : ((JsonArray) tree).encode();
        }
        return value.toString();
    }

    private static ConfigValue fromJson(Object decoded, String raw) {
        if (decoded instanceof JsonObject || decoded instanceof JsonArray) {
            return new StructuredValue(decoded);
        }
        if (decoded instanceof Boolean) {
            return new BooleanValue((Boolean) decoded);
        }
        if (decoded instanceof Integer || decoded instanceof Long
                || decoded instanceof Short || decoded instanceof BigInteger) {
            return new IntegerValue(((Number) decoded).longValue());
        }
        if (decoded instanceof Number) {
            return new FloatValue(((Number) decoded).doubleValue());
        }
        if (decoded instanceof String) {
            return new StringValue((String) decoded);
        }
        // JSON null
        return new StringValue(raw);
    }
}
