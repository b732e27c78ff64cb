package com.resurrector.service.api;

import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.response.AnalysisResponse;
import com.resurrector.exception.AnalysisException;

/**
 * The single entry point of the engine: one request in, one normalized schema out.
 */
public interface SchemaNormalizer {

    /**
     * Validates the request, runs exactly one analyzer and normalizes what it found.
     *
     * @param request The analysis request.
     * @return the normalized resources, never empty.
     * @throws AnalysisException with the {@link com.resurrector.exception.ErrorKind} of the failure.
     */
    AnalysisResponse analyze(AnalysisRequest request);
}
