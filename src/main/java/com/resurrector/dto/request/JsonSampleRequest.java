package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * A raw JSON response sample.
 *
 * @param sampleJson   The JSON text.
 * @param endpointPath Optional path the sample came from.
 * @param method       Optional HTTP method the sample came from.
 */
public record JsonSampleRequest(String sampleJson, String endpointPath, String method) implements AnalysisRequest {

    public JsonSampleRequest(String sampleJson) {
        this(sampleJson, null, null);
    }

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.JSON_SAMPLE;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(AnalysisRequest.requireText(sampleJson, "sampleJson"));
    }
}
