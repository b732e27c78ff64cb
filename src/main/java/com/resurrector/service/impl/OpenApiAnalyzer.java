package com.resurrector.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.request.OpenApiSpecRequest;
import com.resurrector.dto.request.OpenApiUrlRequest;
import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.FormatException;
import com.resurrector.http.FetchedResponse;
import com.resurrector.http.RequestGuard;
import com.resurrector.http.UrlRedactor;
import com.resurrector.inference.ResourceNames;
import com.resurrector.inference.ResponseUnwrapper;
import com.resurrector.inference.TypeInferencer;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.FieldType;
import com.resurrector.model.RawResource;
import com.resurrector.service.api.FormatReader;
import com.resurrector.service.api.ResourceAnalyzer;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Reads OpenAPI 3.x and Swagger 2.0 documents, inline or fetched, and groups their paths into resources.
 * <p>
 * Input is first decoded into a generic tree, so JSON and YAML spellings of the same document are
 * handed to swagger-parser as identical JSON text.
 */
@Service
@Slf4j
public class OpenApiAnalyzer implements ResourceAnalyzer {

    private static final List<String> RESPONSE_CODES = List.of("200", "201", "default");
    private static final Set<PathItem.HttpMethod> BODY_METHODS =
            EnumSet.of(PathItem.HttpMethod.POST, PathItem.HttpMethod.PUT, PathItem.HttpMethod.PATCH);
    private static final Pattern PATH_PARAMETER = Pattern.compile("^\\{([^}]+)}$");
    private static final int MAX_DEPTH = 3;
    private static final int MAX_REF_HOPS = 16;

    private final FormatReader formatReader;
    private final RequestGuard requestGuard;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenApiAnalyzer(FormatReader formatReader, RequestGuard requestGuard) {
        this.formatReader = formatReader;
        this.requestGuard = requestGuard;
    }

    @Override
    public Set<AnalysisMode> modes() {
        return EnumSet.of(AnalysisMode.OPENAPI, AnalysisMode.OPENAPI_URL);
    }

    @Override
    public List<RawResource> analyze(AnalysisRequest request) {
        if (request instanceof OpenApiSpecRequest inline) {
            requestGuard.checkInlineSize(inline.specText(), "OpenAPI document");
            return analyzeDocument(inline.specText(), FormatReader.Hint.UNKNOWN);
        }
        if (request instanceof OpenApiUrlRequest remote) {
            FetchedResponse response = requestGuard.get(remote.specUrl(), headers ->
                    headers.set(HttpHeaders.ACCEPT, "application/json, application/yaml, text/yaml, */*"));
            response.ensureSuccess(UrlRedactor.redact(remote.specUrl()));
            return analyzeDocument(response.bodyAsString(), hintFor(remote.specUrl(), response));
        }
        throw new IllegalArgumentException("OpenApiAnalyzer cannot handle mode " + request.mode());
    }

    List<RawResource> analyzeDocument(String text, FormatReader.Hint hint) {
        OpenAPI openAPI = parse(text, hint);
        if (openAPI.getPaths() == null || openAPI.getPaths().isEmpty()) {
            log.info("OpenAPI document declares no paths");
            return List.of();
        }

        Map<String, RawResource> resources = new LinkedHashMap<>();
        openAPI.getPaths().forEach((path, pathItem) -> {
            String name = ResourceNames.fromPath(path);
            if (name == null) {
                log.debug("Skipping path {} without a resource segment", path);
                return;
            }
            RawResource resource = resources.computeIfAbsent(name,
                    key -> RawResource.named(key, ResourceNames.collectionPath(path)));
            boolean itemScoped = ResourceNames.isItemScoped(path);
            if (itemScoped && resource.getPrimaryKeyHint() == null) {
                resource.setPrimaryKeyHint(idParameter(path));
            }
            pathItem.readOperationsMap().forEach((method, operation) -> {
                resource.observe(method.name(), itemScoped);
                collectResponseFields(operation, resource, openAPI);
                if (BODY_METHODS.contains(method)) {
                    collectRequestFields(operation, resource, openAPI);
                }
            });
        });

        resources.values().stream()
                .filter(resource -> !resource.getDeclaredFields().isEmpty())
                .forEach(resource -> resource.setSamplePayload(null));
        log.info("OpenAPI document '{}' yielded {} resource(s) from {} path(s)",
                title(openAPI), resources.size(), openAPI.getPaths().size());
        return List.copyOf(resources.values());
    }

    private OpenAPI parse(String text, FormatReader.Hint hint) {
        JsonNode tree;
        try {
            tree = formatReader.readTree(text, hint);
        } catch (FormatException e) {
            throw e.toAnalysisException("OpenAPI document");
        }
        if (!tree.isObject()) {
            throw AnalysisException.invalidInput("Invalid OpenAPI document: top level must be an object");
        }
        if (!tree.has("openapi") && !tree.has("swagger")) {
            throw AnalysisException.invalidInput(
                    "Invalid OpenAPI document: neither an 'openapi' nor a 'swagger' version field is present");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Decoded OpenAPI tree cannot be re-serialized", e);
        }

        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);
        SwaggerParseResult result = new OpenAPIParser().readContents(json, null, options);
        List<String> messages = result.getMessages() == null ? List.of() : result.getMessages();
        messages.forEach(message -> log.warn("OpenAPI parser message: {}", message));
        if (result.getOpenAPI() == null) {
            throw AnalysisException.invalidInput("Invalid OpenAPI document: "
                    + (messages.isEmpty() ? "the parser returned no model" : String.join("; ", messages)));
        }
        return result.getOpenAPI();
    }

    private void collectResponseFields(Operation operation, RawResource resource, OpenAPI openAPI) {
        if (operation.getResponses() == null) {
            return;
        }
        for (String code : RESPONSE_CODES) {
            ApiResponse response = operation.getResponses().get(code);
            MediaType media = response == null ? null : jsonMedia(response.getContent());
            if (media == null) {
                continue;
            }
            Schema<?> recordSchema = recordSchema(media.getSchema(), openAPI);
            if (recordSchema != null) {
                collectFields(recordSchema, "", 1, resource.getDeclaredFields(), openAPI);
            }
            if (resource.getSamplePayload() == null) {
                Object example = example(media);
                if (example != null) {
                    resource.setSamplePayload(objectMapper.valueToTree(example));
                }
            }
            return;
        }
    }

    private void collectRequestFields(Operation operation, RawResource resource, OpenAPI openAPI) {
        if (operation.getRequestBody() == null) {
            return;
        }
        MediaType media = jsonMedia(operation.getRequestBody().getContent());
        Schema<?> body = media == null ? null : resolve(media.getSchema(), openAPI);
        if (body != null) {
            collectFields(body, "", 1, resource.getDeclaredFields(), openAPI);
        }
    }

    private static MediaType jsonMedia(Content content) {
        if (content == null) {
            return null;
        }
        for (Map.Entry<String, MediaType> entry : content.entrySet()) {
            String type = entry.getKey().toLowerCase(Locale.ROOT);
            if (type.contains("json") || type.equals("*/*")) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Object example(MediaType media) {
        if (media.getExample() != null) {
            return media.getExample();
        }
        if (media.getExamples() != null) {
            return media.getExamples().values().stream()
                    .filter(example -> example.getValue() != null)
                    .map(example -> (Object) example.getValue())
                    .findFirst()
                    .orElse(null);
        }
        return media.getSchema() == null ? null : media.getSchema().getExample();
    }

    /**
     * Descends through array and envelope schemas to the schema of one record, following the same
     * rules the response unwrapper applies to payloads.
     */
    private Schema<?> recordSchema(Schema<?> schema, OpenAPI openAPI) {
        Schema<?> current = resolve(schema, openAPI);
        for (int level = 0; current != null && level <= MAX_DEPTH; level++) {
            if (isArray(current)) {
                current = resolve(current.getItems(), openAPI);
                continue;
            }
            Schema<?> inner = envelopeChild(properties(current, openAPI), openAPI);
            if (inner == null) {
                return current;
            }
            current = inner;
        }
        return current;
    }

    private Schema<?> envelopeChild(Map<String, Schema<?>> properties, OpenAPI openAPI) {
        if (properties.size() == 1) {
            Schema<?> only = resolve(properties.values().iterator().next(), openAPI);
            if (only != null && isArray(only)) {
                return only;
            }
        }
        for (String key : ResponseUnwrapper.WRAPPER_KEYS) {
            for (Map.Entry<String, Schema<?>> property : properties.entrySet()) {
                if (!property.getKey().equalsIgnoreCase(key)) {
                    continue;
                }
                Schema<?> value = resolve(property.getValue(), openAPI);
                if (value != null && (isArray(value) || !properties(value, openAPI).isEmpty())) {
                    return value;
                }
            }
        }
        return null;
    }

    private void collectFields(Schema<?> schema, String prefix, int depth, Map<String, FieldType> fields,
                               OpenAPI openAPI) {
        properties(schema, openAPI).forEach((name, property) -> {
            String fieldName = prefix + name;
            Schema<?> resolved = resolve(property, openAPI);
            if (resolved == null) {
                fields.putIfAbsent(fieldName, FieldType.STRING);
                return;
            }
            Map<String, Schema<?>> nested = properties(resolved, openAPI);
            if (!isArray(resolved) && !nested.isEmpty() && depth < MAX_DEPTH) {
                collectFields(resolved, fieldName + ".", depth + 1, fields, openAPI);
            } else {
                fields.putIfAbsent(fieldName,
                        TypeInferencer.fromDeclaredType(typeOf(resolved), resolved.getFormat(), resolved.getMaxLength()));
            }
        });
    }

    /**
     * Own properties merged with those of every {@code allOf}, {@code oneOf} and {@code anyOf} member.
     */
    private Map<String, Schema<?>> properties(Schema<?> schema, OpenAPI openAPI) {
        Map<String, Schema<?>> merged = new LinkedHashMap<>();
        mergeProperties(schema, openAPI, merged, 0);
        return merged;
    }

    @SuppressWarnings("rawtypes")
    private void mergeProperties(Schema<?> schema, OpenAPI openAPI, Map<String, Schema<?>> merged, int depth) {
        if (schema == null || depth > MAX_DEPTH) {
            return;
        }
        Map<String, Schema> own = schema.getProperties();
        if (own != null) {
            own.forEach((name, property) -> merged.putIfAbsent(name, property));
        }
        Stream.of(schema.getAllOf(), schema.getOneOf(), schema.getAnyOf())
                .filter(Objects::nonNull)
                .flatMap(List::stream)
                .forEach(member -> mergeProperties(resolve(member, openAPI), openAPI, merged, depth + 1));
    }

    /**
     * Follows local {@code $ref}s that full resolution left in place.
     *
     * @return the target schema, or null when a reference cannot be resolved.
     */
    @SuppressWarnings("rawtypes")
    private Schema<?> resolve(Schema<?> schema, OpenAPI openAPI) {
        Schema<?> current = schema;
        int hops = 0;
        while (current != null && current.get$ref() != null) {
            if (++hops > MAX_REF_HOPS) {
                log.warn("Giving up on reference chain at {}", current.get$ref());
                return null;
            }
            String ref = current.get$ref();
            String name = ref.substring(ref.lastIndexOf('/') + 1);
            Map<String, Schema> schemas = openAPI.getComponents() == null ? null : openAPI.getComponents().getSchemas();
            Schema<?> target = schemas == null ? null : schemas.get(name);
            if (target == null) {
                log.warn("Unresolvable schema reference {}", ref);
                return null;
            }
            current = target;
        }
        return current;
    }

    private static boolean isArray(Schema<?> schema) {
        return "array".equals(typeOf(schema)) || (typeOf(schema) == null && schema.getItems() != null);
    }

    private static String typeOf(Schema<?> schema) {
        if (schema.getType() != null) {
            return schema.getType();
        }
        if (schema.getTypes() != null) {
            return schema.getTypes().stream().filter(type -> !"null".equals(type)).findFirst().orElse(null);
        }
        return null;
    }

    private static String idParameter(String path) {
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (segments[i].isBlank()) {
                continue;
            }
            Matcher matcher = PATH_PARAMETER.matcher(segments[i].trim());
            if (matcher.matches() && matcher.group(1).toLowerCase(Locale.ROOT).contains("id")) {
                return matcher.group(1);
            }
            return null;
        }
        return null;
    }

    private static FormatReader.Hint hintFor(String url, FetchedResponse response) {
        String subtype = response.contentType() == null ? "" : response.contentType().getSubtype().toLowerCase(Locale.ROOT);
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (subtype.contains("yaml") || path.endsWith(".yaml") || path.endsWith(".yml")) {
            return FormatReader.Hint.YAML;
        }
        if (subtype.contains("json") || path.endsWith(".json")) {
            return FormatReader.Hint.JSON;
        }
        return FormatReader.Hint.UNKNOWN;
    }

    private static String title(OpenAPI openAPI) {
        return openAPI.getInfo() == null || openAPI.getInfo().getTitle() == null ? "untitled" : openAPI.getInfo().getTitle();
    }
}
