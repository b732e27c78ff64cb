package com.resurrector.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Recovers the record or record array from common response envelopes such as
 * {@code {"Status": "OK", "Data": {"Users": [...]}}}.
 * <p>
 * Envelope keys are tried in a fixed priority order, so the same body always unwraps the same way.
 */
@Slf4j
public final class ResponseUnwrapper {

    /**
     * Envelope keys, highest priority first. Matched case-insensitively.
     */
    public static final List<String> WRAPPER_KEYS =
            List.of("data", "result", "results", "items", "value", "records", "response", "payload");

    private ResponseUnwrapper() {
    }

    public static UnwrapResult unwrap(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return UnwrapResult.empty();
        }
        if (body.isArray()) {
            return list(body);
        }
        if (!body.isObject()) {
            return UnwrapResult.empty();
        }

        if (body.size() == 1) {
            JsonNode only = body.elements().next();
            if (only.isArray()) {
                log.debug("Unwrapping single-key envelope '{}'", body.fieldNames().next());
                return list(only);
            }
        }

        for (String wrapperKey : WRAPPER_KEYS) {
            Optional<JsonNode> wrapped = findIgnoreCase(body, wrapperKey);
            if (wrapped.isEmpty()) {
                continue;
            }
            JsonNode value = wrapped.get();
            if (value.isArray()) {
                log.debug("Unwrapping envelope key '{}'", wrapperKey);
                return list(value);
            }
            if (value.isObject()) {
                Optional<JsonNode> nested = singleArrayField(value);
                if (nested.isPresent()) {
                    log.debug("Unwrapping nested array under envelope key '{}'", wrapperKey);
                    return list(nested.get());
                }
                if (value.size() > 0) {
                    log.debug("Envelope key '{}' holds a single record", wrapperKey);
                    return new UnwrapResult(List.of((ObjectNode) value), false);
                }
            }
        }

        return new UnwrapResult(List.of((ObjectNode) body), false);
    }

    private static UnwrapResult list(JsonNode array) {
        List<ObjectNode> records = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isObject()) {
                records.add((ObjectNode) element);
            }
        }
        return new UnwrapResult(records, true);
    }

    /**
     * First key, in document order, that equals {@code key} ignoring case.
     */
    private static Optional<JsonNode> findIgnoreCase(JsonNode object, String key) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equalsIgnoreCase(key)) {
                return Optional.of(field.getValue());
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> singleArrayField(JsonNode object) {
        JsonNode found = null;
        Iterator<JsonNode> values = object.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isArray()) {
                if (found != null) {
                    return Optional.empty();
                }
                found = value;
            }
        }
        return Optional.ofNullable(found);
    }
}
