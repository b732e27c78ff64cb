package com.resurrector.model;

/**
 * A single normalized field of a resource.
 *
 * @param name        The source identifier, unique within its resource.
 * @param type        One of the six {@link FieldType}s.
 * @param displayName The human-readable label, never empty.
 */
public record ResourceField(String name, FieldType type, String displayName) {
}
