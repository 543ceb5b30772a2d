package org.example.reporting.report.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts typed rows into the generic field-name to value mappings the pipeline works on.
 */
public final class Rows {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private Rows() {}

    public static List<Map<String, Object>> toMaps(List<?> rows) {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Object row : rows) {
            result.add(toMap(row));
        }
        return result;
    }

    public static Map<String, Object> toMap(Object row) {
        return MAPPER.convertValue(row, ROW_TYPE);
    }

    /**
     * Resolves a dotted path ({@code details.status}) against a row. Intermediate values that are
     * not mappings resolve to {@code null}.
     */
    public static Object lookup(Map<String, ?> row, String dottedPath) {
        Object current = row;
        for (String part : dottedPath.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    /** String form of a cell value; {@code null} becomes the empty string. */
    public static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
