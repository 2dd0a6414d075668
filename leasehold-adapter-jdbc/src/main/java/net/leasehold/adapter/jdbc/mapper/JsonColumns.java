package net.leasehold.adapter.jdbc.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** PARAMETERS / RESULT / METADATA (CLOB), TAGS (VARCHAR) 의 JSON 직렬화 */
public final class JsonColumns {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonColumns() {}

    public static String write(JsonNode node) {
        if (node == null || node.isNull()) return null;
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable JSON payload", e);
        }
    }

    public static JsonNode read(String json, String column) throws SQLException {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLDataException("malformed JSON in column " + column, e);
        }
    }

    public static String writeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        try {
            return MAPPER.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable tags", e);
        }
    }

    public static List<String> readTags(String json) throws SQLException {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLDataException("malformed JSON in column TAGS", e);
        }
    }

    public static String writeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            // 키 순서를 고정해 같은 맵이면 같은 문자열
            return MAPPER.writeValueAsString(new TreeMap<>(metadata));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable metadata", e);
        }
    }

    public static Map<String, String> readMetadata(String json) throws SQLException {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return MAPPER.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new SQLDataException("malformed JSON in column METADATA", e);
        }
    }
}
