package com.resurrector.model;

import java.util.List;

/**
 * The normalized description of one API resource.
 *
 * @param name        Lower-case resource identifier, unique within a result set.
 * @param displayName Human-readable resource label.
 * @param endpoint    The API path, or {@link #SAMPLE_ENDPOINT} when no real endpoint exists.
 * @param primaryKey  The identifying field. May name a field that is absent ("id") when nothing better was found.
 * @param fields      The ordered fields of the resource.
 * @param operations  The CRUD operations the resource supports, in declaration order of {@link CrudOperation}.
 */
public record ResourceSchema(
        String name,
        String displayName,
        String endpoint,
        String primaryKey,
        List<ResourceField> fields,
        List<CrudOperation> operations
) {
    public static final String SAMPLE_ENDPOINT = "__sample";

    public ResourceSchema {
        fields = List.copyOf(fields);
        operations = List.copyOf(operations);
    }
}
