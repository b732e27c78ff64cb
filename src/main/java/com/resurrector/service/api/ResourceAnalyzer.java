package com.resurrector.service.api;

import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.exception.AnalysisException;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.RawResource;
import java.util.List;
import java.util.Set;

/**
 * Extracts raw resource descriptions from one family of input formats.
 */
public interface ResourceAnalyzer {

    /**
     * @return the modes this analyzer accepts; no two analyzers may share a mode.
     */
    Set<AnalysisMode> modes();

    /**
     * Analyzes a validated request.
     *
     * @param request A request whose {@link AnalysisRequest#mode()} is one of {@link #modes()}.
     * @return the raw resources found, possibly empty for well-formed input that describes nothing.
     * @throws AnalysisException if the input cannot be read, fetched or parsed.
     */
    List<RawResource> analyze(AnalysisRequest request);
}
