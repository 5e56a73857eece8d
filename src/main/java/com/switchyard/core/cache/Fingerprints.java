package com.switchyard.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.switchyard.core.model.InvalidParametersException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;

/**
 * Canonical serialization and hashing of invocation parameters.
 * <p>
 * Map keys are sorted at every nesting level, so two parameter maps with the
 * same content always produce the same fingerprint regardless of insertion order.
 * Only scalars, collections, arrays and string-keyed maps are accepted.
 */
public final class Fingerprints {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private Fingerprints() {}

    /**
     * SHA-256 of {@code tool + '|' + canonicalJson(parameters)}, hex encoded.
     *
     * @throws InvalidParametersException if the parameters are not deterministically serializable
     */
    public static String of(String tool, Map<String, Object> parameters) {
        return sha256(tool + "|" + canonicalJson(parameters));
    }

    public static String canonicalJson(Map<String, Object> parameters) {
        if (parameters == null) {
            return "{}";
        }
        validate("", parameters);
        try {
            return CANONICAL.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new InvalidParametersException("Parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Approximate in-memory footprint of a payload: the length of its JSON form.
     * Falls back to the length of {@code toString()} when the payload is not serializable.
     */
    public static long estimateSize(Object payload) {
        if (payload == null) {
            return 4;
        }
        try {
            return CANONICAL.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            return payload.toString().getBytes(StandardCharsets.UTF_8).length;
        }
    }

    private static void validate(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Character || value instanceof Enum<?>) {
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                throw new InvalidParametersException("Parameter '" + path + "' is not a finite number");
            }
            if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
                throw new InvalidParametersException("Parameter '" + path + "' is not a finite number");
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new InvalidParametersException("Parameter '" + path + "' has a non-string key: "
                            + entry.getKey());
                }
                validate(path.isEmpty() ? key : path + "." + key, entry.getValue());
            }
            return;
        }
        if (value instanceof Collection<?> collection) {
            int i = 0;
            for (Object item : collection) {
                validate(path + "[" + i++ + "]", item);
            }
            return;
        }
        if (value.getClass().isArray()) {
            if (value instanceof Object[] array) {
                for (int i = 0; i < array.length; i++) {
                    validate(path + "[" + i + "]", array[i]);
                }
            }
            return;
        }
        throw new InvalidParametersException("Parameter '" + path + "' has unsupported type "
                + value.getClass().getSimpleName());
    }

    static String sha256(String s) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
