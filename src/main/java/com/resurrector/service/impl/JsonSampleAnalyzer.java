package com.resurrector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.request.JsonSampleRequest;
import com.resurrector.exception.FormatException;
import com.resurrector.http.RequestGuard;
import com.resurrector.inference.ResourceNames;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.RawResource;
import com.resurrector.model.ResourceSchema;
import com.resurrector.service.api.FormatReader;
import com.resurrector.service.api.ResourceAnalyzer;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Turns a pasted JSON example into one sample-backed resource. No network access.
 */
@Service
public class JsonSampleAnalyzer implements ResourceAnalyzer {

    static final String SAMPLE_NAME = "sample";

    private final FormatReader formatReader;
    private final RequestGuard requestGuard;

    public JsonSampleAnalyzer(FormatReader formatReader, RequestGuard requestGuard) {
        this.formatReader = formatReader;
        this.requestGuard = requestGuard;
    }

    @Override
    public Set<AnalysisMode> modes() {
        return EnumSet.of(AnalysisMode.JSON_SAMPLE);
    }

    @Override
    public List<RawResource> analyze(AnalysisRequest request) {
        if (!(request instanceof JsonSampleRequest sample)) {
            throw new IllegalArgumentException("JsonSampleAnalyzer cannot handle mode " + request.mode());
        }
        requestGuard.checkInlineSize(sample.sampleJson(), "JSON sample");
        JsonNode tree;
        try {
            tree = formatReader.readTree(sample.sampleJson(), FormatReader.Hint.JSON);
        } catch (FormatException e) {
            throw e.toAnalysisException("JSON sample");
        }

        String path = sample.endpointPath() == null || sample.endpointPath().isBlank() ? null : sample.endpointPath().trim();
        String name = path == null ? null : ResourceNames.fromPath(path);
        RawResource resource = RawResource.named(name == null ? SAMPLE_NAME : name,
                path == null ? ResourceSchema.SAMPLE_ENDPOINT : path);
        resource.setSamplePayload(tree);
        resource.setFromSample(true);
        if (sample.method() != null && !sample.method().isBlank()) {
            resource.observe(sample.method(), path != null && ResourceNames.isItemScoped(path));
        }
        return List.of(resource);
    }
}
