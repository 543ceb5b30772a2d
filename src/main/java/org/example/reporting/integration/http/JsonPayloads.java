package org.example.reporting.integration.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for listing payloads whose shape varies between endpoints.
 */
public final class JsonPayloads {

    private static final List<String> LIST_KEYS = List.of("builds", "projects", "items", "data", "results");

    private JsonPayloads() {}

    /**
     * Returns the object records of a listing payload: either a bare array or an object holding
     * the array under one of the well-known keys. Anything else yields an empty list.
     */
    public static List<JsonNode> records(JsonNode payload) {
        if (payload == null) {
            return List.of();
        }
        if (payload.isArray()) {
            return objects(payload);
        }
        if (payload.isObject()) {
            for (String key : LIST_KEYS) {
                JsonNode value = payload.get(key);
                if (value != null && value.isArray()) {
                    return objects(value);
                }
            }
        }
        return List.of();
    }

    public static boolean hasNext(JsonNode payload) {
        return payload != null && payload.path("pagination").path("has_next").asBoolean(false);
    }

    /** Cursor from {@code pagination.next_page}, falling back to a top-level {@code next_page}. */
    public static String nextCursor(JsonNode payload) {
        if (payload == null) {
            return "";
        }
        String cursor = text(payload.path("pagination").get("next_page"));
        if (cursor.isEmpty()) {
            cursor = text(payload.get("next_page"));
        }
        return cursor;
    }

    /** First non-empty textual value among the given fields. */
    public static String firstText(JsonNode record, String... fields) {
        for (String field : fields) {
            String value = text(record.get(field));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return "";
        }
        return node.asText("");
    }

    private static List<JsonNode> objects(JsonNode array) {
        List<JsonNode> result = new ArrayList<>();
        for (JsonNode item : array) {
            if (item != null && item.isObject()) {
                result.add(item);
            }
        }
        return result;
    }
}
