package com.switchyard.core.metrics;

import java.util.Locale;

public enum ExportFormat {
    JSON("application/json", "json"),
    CSV("text/csv", "csv");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    public static ExportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value + " (expected json or csv)", e);
        }
    }
}
