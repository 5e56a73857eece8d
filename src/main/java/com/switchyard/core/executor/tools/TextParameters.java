package com.switchyard.core.executor.tools;

import java.util.Map;

/**
 * Parameter access shared by the built-in text tools.
 */
final class TextParameters {

    private TextParameters() {}

    static String requireText(Map<String, Object> parameters) {
        Object text = parameters.get("text");
        if (text == null) {
            throw new IllegalArgumentException("Missing required parameter 'text'");
        }
        if (!(text instanceof String s)) {
            throw new IllegalArgumentException("Parameter 'text' must be a string");
        }
        return s;
    }

    static int optionalPositiveInt(Map<String, Object> parameters, String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        if (value instanceof Number n) {
            parsed = n.intValue();
        } else {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' must be an integer", e);
            }
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be positive");
        }
        return parsed;
    }

    static String[] words(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
