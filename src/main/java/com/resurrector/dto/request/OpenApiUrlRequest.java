package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * An OpenAPI document to fetch from a URL.
 *
 * @param specUrl Absolute http(s) URL of the document.
 */
public record OpenApiUrlRequest(String specUrl) implements AnalysisRequest {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.OPENAPI_URL;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(AnalysisRequest.requireHttpUrl(specUrl, "specUrl"));
    }
}
