package org.example.reporting.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputFormat {
    CSV, XLSX, MD, JSON;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutputFormat fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Output format must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("MARKDOWN".equals(normalized)) {
            return MD;
        }
        try {
            return OutputFormat.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format: " + value + " (expected csv, xlsx, md or json)", e);
        }
    }
}
