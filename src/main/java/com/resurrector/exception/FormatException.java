package com.resurrector.exception;

/**
 * Raised when raw text cannot be decoded as JSON, YAML or XML.
 * <p>
 * The message names the format and, when the parser reports one, the line and column of the
 * problem. Analyzers translate it into an {@link ErrorKind#INVALID_INPUT} failure.
 */
public class FormatException extends RuntimeException {

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public FormatException(String message) {
        super(message);
    }

    public AnalysisException toAnalysisException(String what) {
        return new AnalysisException(ErrorKind.INVALID_INPUT, "Invalid " + what + ": " + getMessage(), this);
    }
}
