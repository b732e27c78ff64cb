package com.resurrector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.request.EndpointRequest;
import com.resurrector.exception.FormatException;
import com.resurrector.http.AuthHeaders;
import com.resurrector.http.FetchedResponse;
import com.resurrector.http.RequestGuard;
import com.resurrector.http.UrlRedactor;
import com.resurrector.inference.ResourceNames;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.AuthType;
import com.resurrector.model.RawResource;
import com.resurrector.service.api.FormatReader;
import com.resurrector.service.api.ResourceAnalyzer;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/**
 * Calls a live REST endpoint once and hands its JSON body on as a sample payload.
 */
@Service
@Slf4j
public class EndpointAnalyzer implements ResourceAnalyzer {

    private static final String FALLBACK_NAME = "resource";

    private final FormatReader formatReader;
    private final RequestGuard requestGuard;

    public EndpointAnalyzer(FormatReader formatReader, RequestGuard requestGuard) {
        this.formatReader = formatReader;
        this.requestGuard = requestGuard;
    }

    @Override
    public Set<AnalysisMode> modes() {
        return EnumSet.of(AnalysisMode.ENDPOINT);
    }

    @Override
    public List<RawResource> analyze(AnalysisRequest request) {
        if (!(request instanceof EndpointRequest endpoint)) {
            throw new IllegalArgumentException("EndpointAnalyzer cannot handle mode " + request.mode());
        }
        String url = endpoint.targetUrl();
        String redacted = UrlRedactor.redact(url);
        AuthType authType = AuthType.parse(endpoint.authType());

        FetchedResponse response = requestGuard.fetch(HttpMethod.valueOf(endpoint.effectiveMethod()), url, headers -> {
            headers.set(HttpHeaders.ACCEPT, "application/json");
            AuthHeaders.apply(headers, authType, endpoint.authValue(), endpoint.apiKeyHeader(), endpoint.customHeaders());
            log.debug("Sending headers [{}] to {}", AuthHeaders.describe(headers), redacted);
        }, null, null);
        response.ensureSuccess(redacted);

        JsonNode body;
        try {
            body = formatReader.readTree(response.bodyAsString(), FormatReader.Hint.JSON);
        } catch (FormatException e) {
            throw e.toAnalysisException("JSON response from " + redacted);
        }

        String path = endpoint.endpointPath().trim();
        String name = ResourceNames.fromPath(path);
        RawResource resource = RawResource.named(name == null ? FALLBACK_NAME : name, path);
        resource.setSamplePayload(body);
        resource.observe(endpoint.effectiveMethod(), ResourceNames.isItemScoped(path));
        return List.of(resource);
    }
}
