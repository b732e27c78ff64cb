package com.resurrector.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * What an analyzer discovered about one resource, before shared normalization.
 * <p>
 * A resource is described either by declared field types (OpenAPI, WSDL), by a sample payload
 * that still has to be unwrapped and inferred (live endpoints, JSON and SOAP samples), or both.
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class RawResource {

    /**
     * The resource identifier as the analyzer derived it.
     */
    private String name;

    /**
     * The API path, or {@link ResourceSchema#SAMPLE_ENDPOINT}.
     */
    private String endpoint;

    /**
     * A decoded response body that still has to pass through the response unwrapper.
     */
    private JsonNode samplePayload;

    /**
     * Fields whose type was declared by a schema, in discovery order.
     */
    private Map<String, FieldType> declaredFields = new LinkedHashMap<>();

    /**
     * HTTP methods observed against this resource.
     */
    private List<ObservedCall> observedCalls = new ArrayList<>();

    /**
     * SOAP operation names attributed to this resource.
     */
    private List<String> soapOperations = new ArrayList<>();

    /**
     * A primary key suggested by the source, such as an id-like path parameter.
     */
    private String primaryKeyHint;

    /**
     * Whether the resource was inferred from a sample without any server interaction.
     */
    private boolean fromSample;

    public static RawResource named(String name, String endpoint) {
        RawResource resource = new RawResource();
        resource.setName(name);
        resource.setEndpoint(endpoint);
        return resource;
    }

    public void declareField(String fieldName, FieldType type) {
        declaredFields.putIfAbsent(fieldName, type);
    }

    public void observe(String method, boolean itemScoped) {
        ObservedCall call = new ObservedCall(method, itemScoped);
        if (!observedCalls.contains(call)) {
            observedCalls.add(call);
        }
    }
}
