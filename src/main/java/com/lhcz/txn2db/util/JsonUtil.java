package com.lhcz.txn2db.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;

public class JsonUtil {
    private static final ObjectMapper mapper = new ObjectMapper();

    static {
        // 时间统一输出 ISO-8601 字符串，不用数字时间戳
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private JsonUtil() {
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static JsonNode readTree(String json) throws IOException {
        return mapper.readTree(json);
    }

    /**
     * 转为紧凑 JSON 字符串 (写入 JSON 列)
     */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON conversion failed", e);
        }
    }

    /**
     * 取文本字段，缺失或为 null 时返回 null
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    /**
     * 链上 u64 在 JSON 中以字符串表示，这里统一解析；缺失时抛异常
     */
    public static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new IllegalArgumentException("缺少字段: " + field);
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        return Long.parseLong(value.asText());
    }

    public static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.isNumber() ? value.asLong() : Long.parseLong(value.asText());
    }

    public static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return new BigDecimal(value.asText());
    }

    /**
     * 微秒时间戳字符串 -> Instant
     */
    public static Instant micros(JsonNode node, String field) {
        long micros = requiredLong(node, field);
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }
}
