package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of entity a quality series belongs to.
 *
 * @since 1.0.0
 */
public enum EntityType {

    DOCUMENT,
    CHUNK,
    SYSTEM;

    /**
     * @return lowercase wire value, e.g. {@code document}
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire value, case-insensitively.
     *
     * @param value the wire value
     * @return matching entity type
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        for (EntityType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: '" + value
                + "'. Supported: document, chunk, system");
    }
}
