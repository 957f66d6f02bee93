package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Validated PolicyProfile document.
 *
 * @param document deep copy of the validated JSON; callers must not mutate it
 */
public record PolicyProfileContract(String schemaVersion, String profileId, String environment, JsonNode document) {

    /** Longer index segments may not fit an {@code int} and never resolve. */
    private static final int MAX_INDEX_DIGITS = 9;

    /**
     * Resolves a dotted path such as {@code constraints.max_autonomous_steps} against the
     * profile document. Numeric segments index into arrays.
     *
     * @return the value, or empty when any segment is missing or is not a usable array index
     */
    public Optional<JsonNode> resolvePath(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            return Optional.empty();
        }
        JsonNode current = document;
        for (String segment : dottedPath.split("\\.")) {
            if (current == null || segment.isEmpty()) {
                return Optional.empty();
            }
            if (current.isArray()) {
                if (segment.length() > MAX_INDEX_DIGITS || !segment.chars().allMatch(Character::isDigit)) {
                    return Optional.empty();
                }
                current = current.get(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }
}
