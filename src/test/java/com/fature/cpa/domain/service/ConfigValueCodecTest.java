package com.fature.cpa.domain.service;

import com.fature.cpa.domain.model.ConfigValue;
import com.fature.cpa.domain.model.ConfigValue.BooleanValue;
import com.fature.cpa.domain.model.ConfigValue.FloatValue;
import com.fature.cpa.domain.model.ConfigValue.IntegerValue;
import com.fature.cpa.domain.model.ConfigValue.StringValue;
import com.fature.cpa.domain.model.ConfigValue.StructuredValue;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigValueCodec
 */
class ConfigValueCodecTest {

    @Test
    void decode_boolTrue() {
        ConfigValue value = ConfigValueCodec.decode("true", "bool");

        assertEquals(new BooleanValue(true), value);
        assertTrue(value.isTrue());
    }

    @Test
    void decode_boolIsCaseInsensitiveAndFalseOtherwise() {
        assertEquals(new BooleanValue(true), ConfigValueCodec.decode("TRUE", "bool"));
        assertEquals(new BooleanValue(false), ConfigValueCodec.decode("yes", "bool"));
    }

    @Test
    void decode_float() {
        ConfigValue value = ConfigValueCodec.decode("12.5", "float");

        assertEquals(new FloatValue(12.5), value);
        assertEquals(0, new BigDecimal("12.5").compareTo(value.asNumber().orElseThrow()));
    }

    @Test
    void decode_int() {
        assertEquals(new IntegerValue(10), ConfigValueCodec.decode("10", "int"));
    }

    @Test
    void decode_malformedIntFallsBackToRawString() {
        ConfigValue value = assertDoesNotThrow(() -> ConfigValueCodec.decode("abc", "int"));

        assertEquals(new StringValue("abc"), value);
        assertTrue(value.asNumber().isEmpty());
    }

    @Test
    void decode_malformedFloatFallsBackToRawString() {
        assertEquals(new StringValue("1,5"), ConfigValueCodec.decode("1,5", "float"));
        assertEquals(new StringValue("NaN"), ConfigValueCodec.decode("NaN", "float"));
    }

    @Test
    void decode_jsonObject() {
        ConfigValue value = ConfigValueCodec.decode("{\"limit\": 5, \"tags\": [\"a\"]}", "json");

        assertInstanceOf(StructuredValue.class, value);
        JsonObject tree = (JsonObject) value.raw();
        assertEquals(5, tree.getInteger("limit"));
        assertEquals(new JsonArray().add("a"), tree.getJsonArray("tags"));
    }

    @Test
    void decode_malformedJsonFallsBackToRawString() {
        assertEquals(new StringValue("{broken"), ConfigValueCodec.decode("{broken", "json"));
    }

    @Test
    void decode_unknownTypeKeepsString() {
        assertEquals(new StringValue("America/Sao_Paulo"),
                ConfigValueCodec.decode("America/Sao_Paulo", "string"));
        assertEquals(new StringValue("30"), ConfigValueCodec.decode("30", null));
    }

    @Test
    void decodeCached_restoresScalarTypes() {
        assertEquals(new IntegerValue(30), ConfigValueCodec.decodeCached("30"));
        assertEquals(new FloatValue(30.5), ConfigValueCodec.decodeCached("30.5"));
        assertEquals(new BooleanValue(true), ConfigValueCodec.decodeCached("true"));
        assertEquals(new StringValue("America/Sao_Paulo"), ConfigValueCodec.decodeCached("America/Sao_Paulo"));
    }

    @Test
    void encodeForCache_thenDecodeCached_keepsStructuredValues() {
        ConfigValue original = ConfigValueCodec.decode("{\"a\":1}", "json");

        String text = ConfigValueCodec.encodeForCache(original);

        assertEquals("{\"a\":1}", text);
        assertEquals(original, ConfigValueCodec.decodeCached(text));
    }

    @Test
    void encodeForCache_floatKeepsDecimalPoint() {
        assertEquals("30.0", ConfigValueCodec.encodeForCache(new FloatValue(30.0)));
        assertEquals(new FloatValue(30.0), ConfigValueCodec.decodeCached("30.0"));
    }
}
