package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import com.resurrector.model.AuthType;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A live REST endpoint to call once and infer a resource from.
 *
 * @param baseUrl       Scheme and host of the API, e.g. {@code https://legacy.example.com}.
 * @param endpointPath  Path of the endpoint, e.g. {@code /api/v1/users}.
 * @param method        {@code GET} (default) or {@code POST}.
 * @param authType      none, bearer, api-key or basic.
 * @param authValue     The token, key, or {@code user:password} for basic auth.
 * @param apiKeyHeader  Header carrying the api key; {@code X-API-Key} when blank.
 * @param customHeaders Extra headers sent as-is.
 */
public record EndpointRequest(
        String baseUrl,
        String endpointPath,
        String method,
        String authType,
        String authValue,
        String apiKeyHeader,
        Map<String, String> customHeaders
) implements AnalysisRequest {

    public EndpointRequest {
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
    }

    public EndpointRequest(String baseUrl, String endpointPath) {
        this(baseUrl, endpointPath, null, null, null, null, null);
    }

    public String effectiveMethod() {
        return method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Base URL and path joined with exactly one slash between them.
     */
    public String targetUrl() {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = endpointPath == null ? "" : endpointPath.trim();
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.ENDPOINT;
    }

    @Override
    public List<String> problems() {
        List<String> problems = AnalysisRequest.collect(
                AnalysisRequest.requireHttpUrl(baseUrl, "baseUrl"),
                AnalysisRequest.requireText(endpointPath, "endpointPath"));
        if (problems.isEmpty()) {
            try {
                new URI(targetUrl());
            } catch (URISyntaxException e) {
                problems.add("endpointPath must be a concrete URL path, got '" + endpointPath.trim()
                        + "' (" + e.getReason() + ")");
            }
        }
        String verb = effectiveMethod();
        if (!verb.equals("GET") && !verb.equals("POST")) {
            problems.add("method must be GET or POST, was " + verb);
        }
        try {
            AuthType type = AuthType.parse(authType);
            if (type == AuthType.WSSE) {
                problems.add("authType wsse is only supported for soap_endpoint");
            } else if (type != AuthType.NONE && (authValue == null || authValue.isBlank())) {
                problems.add("authValue is required for authType " + authType);
            } else if (type == AuthType.BASIC && !authValue.contains(":")) {
                problems.add("authValue for basic auth must look like user:password");
            }
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        return problems;
    }

    @Override
    public String toString() {
        return "EndpointRequest[baseUrl=" + baseUrl + ", endpointPath=" + endpointPath + ", method=" + effectiveMethod()
                + ", authType=" + authType + ", customHeaders=" + customHeaders.keySet() + "]";
    }
}
