package com.lsemantica.core.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Enum constants that serialize to a lowercase wire literal instead of their Java name.
 */
public interface WireValue {

    String wireValue();

    /**
     * Parses a wire literal into the matching constant of {@code type}.
     *
     * @param type  enum type implementing {@link WireValue}
     * @param value raw value, trimmed before matching
     * @param path  field path used in the error message
     * @throws IllegalArgumentException when the value is blank or not one of the allowed literals
     */
    static <E extends Enum<E> & WireValue> E parse(Class<E> type, String value, String path) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(path + " must be a non-empty string");
        }
        String normalized = value.trim();
        for (E constant : type.getEnumConstants()) {
            if (constant.wireValue().equals(normalized)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(path + " must be one of: " + allowed(type)
                + "; received \"" + normalized + "\"");
    }

    static <E extends Enum<E> & WireValue> String allowed(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(WireValue::wireValue)
                .collect(Collectors.joining(", "));
    }
}
