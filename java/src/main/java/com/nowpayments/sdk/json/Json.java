package com.nowpayments.sdk.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/** Shared Jackson mappers. All of them are thread-safe once configured. */
public final class Json {

    /** JSON object as an ordered map. */
    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper WIRE = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private static final ObjectMapper MODEL = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .addModule(new JavaTimeModule())
            .addModule(new SimpleModule("nowpayments-lenient-time")
                    .addDeserializer(OffsetDateTime.class, new LenientOffsetDateTimeDeserializer()))
            .build();

    // Compact, ASCII-only output; fails on values that have no JSON form.
    private static final ObjectMapper CANONICAL = JsonMapper.builder(
                    new JsonFactoryBuilder().characterEscapes(new AsciiOnlyEscapes()).build())
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .addModule(new SimpleModule("nowpayments-float-repr")
                    .addSerializer(Double.class, new FloatReprSerializer())
                    .addSerializer(Float.class, new FloatReprSerializer())
                    .addSerializer(BigDecimal.class, new FloatReprSerializer()))
            .build();

    private Json() {}

    /** Mapper for raw response parsing; floats become BigDecimal. */
    public static ObjectMapper wire() {
        return WIRE;
    }

    /**
     * Mapper for the model classes: snake_case on the wire, nulls omitted,
     * unknown properties ignored. Request bodies are written with it too.
     */
    public static ObjectMapper model() {
        return MODEL;
    }

    /**
     * Mapper producing the signed IPN message. Reading keeps the sender's
     * decimal digits; writing renders floats in the sender's notation.
     */
    public static ObjectMapper canonical() {
        return CANONICAL;
    }
}
