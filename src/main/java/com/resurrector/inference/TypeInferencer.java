package com.resurrector.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.model.FieldType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps sample values and declared schema types onto the six {@link FieldType}s.
 * Deterministic: the same input always yields the same type.
 */
public final class TypeInferencer {

    public static final int LONG_TEXT_THRESHOLD = 100;

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s.]+$");

    private static final Pattern ISO_DATE = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}"
                    + "([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}(:?\\d{2})?)?)?$");

    private static final Pattern NUMERIC = Pattern.compile("^-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?$");

    // Higher wins when samples of one field disagree.
    private static final List<FieldType> FLEXIBILITY = List.of(
            FieldType.BOOLEAN, FieldType.NUMBER, FieldType.DATE, FieldType.EMAIL, FieldType.STRING, FieldType.TEXT);

    private static final Map<String, FieldType> XSD_TYPES = Map.ofEntries(
            Map.entry("int", FieldType.NUMBER),
            Map.entry("integer", FieldType.NUMBER),
            Map.entry("long", FieldType.NUMBER),
            Map.entry("short", FieldType.NUMBER),
            Map.entry("byte", FieldType.NUMBER),
            Map.entry("float", FieldType.NUMBER),
            Map.entry("double", FieldType.NUMBER),
            Map.entry("decimal", FieldType.NUMBER),
            Map.entry("positiveinteger", FieldType.NUMBER),
            Map.entry("negativeinteger", FieldType.NUMBER),
            Map.entry("nonpositiveinteger", FieldType.NUMBER),
            Map.entry("nonnegativeinteger", FieldType.NUMBER),
            Map.entry("unsignedint", FieldType.NUMBER),
            Map.entry("unsignedlong", FieldType.NUMBER),
            Map.entry("unsignedshort", FieldType.NUMBER),
            Map.entry("unsignedbyte", FieldType.NUMBER),
            Map.entry("boolean", FieldType.BOOLEAN),
            Map.entry("date", FieldType.DATE),
            Map.entry("datetime", FieldType.DATE));

    private TypeInferencer() {
    }

    /**
     * Infers the type of one sample value. Null, missing and container values cannot be
     * classified more precisely and come out as {@link FieldType#STRING}.
     */
    public static FieldType fromValue(JsonNode value) {
        return infer(value).orElse(FieldType.STRING);
    }

    /**
     * Infers one type from all samples of a field, skipping nulls. Conflicts resolve to the
     * most flexible type seen.
     */
    public static FieldType fromValues(List<JsonNode> values) {
        FieldType widest = null;
        for (JsonNode value : values) {
            Optional<FieldType> inferred = infer(value);
            if (inferred.isPresent() && (widest == null || rank(inferred.get()) > rank(widest))) {
                widest = inferred.get();
            }
        }
        return widest == null ? FieldType.STRING : widest;
    }

    /**
     * Returns the type of a value, or empty when the value carries no type information.
     */
    public static Optional<FieldType> infer(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(FieldType.BOOLEAN);
        }
        if (value.isNumber()) {
            return Optional.of(FieldType.NUMBER);
        }
        if (value.isTextual()) {
            return Optional.of(fromString(value.asText()));
        }
        return Optional.of(FieldType.STRING);
    }

    /**
     * Classifies a string by shape: email, ISO-8601 date, long text, or plain string.
     */
    public static FieldType fromString(String value) {
        String trimmed = value.trim();
        if (EMAIL.matcher(trimmed).matches()) {
            return FieldType.EMAIL;
        }
        if (ISO_DATE.matcher(trimmed).matches()) {
            return FieldType.DATE;
        }
        if (value.length() > LONG_TEXT_THRESHOLD) {
            return FieldType.TEXT;
        }
        return FieldType.STRING;
    }

    /**
     * Classifies untyped text content, as found in XML, where booleans and numbers are only
     * recognisable lexically.
     */
    public static FieldType fromLexical(String text) {
        if (text == null || text.isBlank()) {
            return FieldType.STRING;
        }
        String trimmed = text.trim();
        if (trimmed.equals("true") || trimmed.equals("false")) {
            return FieldType.BOOLEAN;
        }
        if (isNumericLiteral(trimmed)) {
            return FieldType.NUMBER;
        }
        return fromString(text);
    }

    public static boolean isNumericLiteral(String text) {
        return NUMERIC.matcher(text).matches();
    }

    /**
     * Maps an OpenAPI {@code type}/{@code format} pair. A {@code maxLength} above 100 marks a
     * plain string as long text.
     */
    public static FieldType fromDeclaredType(String type, String format, Integer maxLength) {
        String declared = type == null ? "string" : type.toLowerCase(Locale.ROOT);
        String fmt = format == null ? "" : format.toLowerCase(Locale.ROOT);
        switch (declared) {
            case "integer":
            case "number":
                return FieldType.NUMBER;
            case "boolean":
                return FieldType.BOOLEAN;
            case "string":
                if (fmt.equals("date") || fmt.equals("date-time") || fmt.equals("datetime")) {
                    return FieldType.DATE;
                }
                if (fmt.equals("email")) {
                    return FieldType.EMAIL;
                }
                if (maxLength != null && maxLength > LONG_TEXT_THRESHOLD) {
                    return FieldType.TEXT;
                }
                return FieldType.STRING;
            default:
                return FieldType.STRING;
        }
    }

    public static FieldType fromDeclaredType(String type, String format) {
        return fromDeclaredType(type, format, null);
    }

    /**
     * Maps an XML Schema simple type such as {@code xsd:int} or {@code s:dateTime}.
     */
    public static FieldType fromXsdType(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            return FieldType.STRING;
        }
        String local = qualifiedName.substring(qualifiedName.indexOf(':') + 1).toLowerCase(Locale.ROOT);
        return XSD_TYPES.getOrDefault(local, FieldType.STRING);
    }

    private static int rank(FieldType type) {
        return FLEXIBILITY.indexOf(type);
    }
}
