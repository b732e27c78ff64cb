package com.resurrector.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The CRUD capability tags attached to a resource. Declaration order is the order in which
 * operations are emitted.
 */
public enum CrudOperation {
    LIST,
    DETAIL,
    CREATE,
    UPDATE,
    DELETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
