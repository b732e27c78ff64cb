package com.resurrector.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The fixed set of field types a normalized resource may carry.
 * <p>
 * Anything that cannot be classified more precisely is a {@link #STRING}.
 */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    EMAIL,
    TEXT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
