package com.resurrector.dto.response;

import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;

/**
 * The failed outcome of an analysis, rendered as {@code {"error": {"kind": ..., "message": ...}}}.
 *
 * @param error The error body.
 */
public record ErrorResponse(Body error) {

    /**
     * @param kind    The stable error classification.
     * @param message A human-readable, credential-free explanation.
     */
    public record Body(ErrorKind kind, String message) {
    }

    public static ErrorResponse of(AnalysisException e) {
        return new ErrorResponse(new Body(e.getKind(), e.getMessage()));
    }
}
