package com.resurrector.exception;

import lombok.Getter;

/**
 * A runtime exception signalling that one analysis request failed.
 * <p>
 * It carries a stable {@link ErrorKind} so the calling layer can map it to a transport status.
 * Messages describe what was attempted and why it failed; they must never contain credentials.
 */
@Getter
public class AnalysisException extends RuntimeException {

    private final ErrorKind kind;

    public AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static AnalysisException invalidInput(String message) {
        return new AnalysisException(ErrorKind.INVALID_INPUT, message);
    }

    public static AnalysisException noResources(String message) {
        return new AnalysisException(ErrorKind.NO_RESOURCES_FOUND, message);
    }
}
