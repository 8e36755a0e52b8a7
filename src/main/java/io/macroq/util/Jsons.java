package io.macroq.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper compact() {
        return COMPACT_MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return COMPACT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static byte[] toBytes(Object value) throws JsonProcessingException {
        return COMPACT_MAPPER.writeValueAsBytes(value);
    }

    public static <T> T fromBytes(byte[] raw, Class<T> type) throws IOException {
        return COMPACT_MAPPER.readValue(raw, type);
    }
}
