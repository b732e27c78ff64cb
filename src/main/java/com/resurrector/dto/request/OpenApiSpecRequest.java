package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * An inline OpenAPI 3.x or Swagger 2.0 document, as JSON or YAML text.
 *
 * @param specText The document text.
 */
public record OpenApiSpecRequest(String specText) implements AnalysisRequest {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.OPENAPI;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(AnalysisRequest.requireText(specText, "specText"));
    }
}
