package com.resurrector.dto.response;

/**
 * Outcome of one {@code analyze} invocation as shown in the shell.
 *
 * @param success Whether the command produced a schema.
 * @param message The rendered schema document or the error document.
 */
public record CommandResponse(boolean success, String message) {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    public static CommandResponse schema(String document) {
        return new CommandResponse(true, document);
    }

    public static CommandResponse failure(String errorDocument) {
        return new CommandResponse(false, errorDocument);
    }

    /**
     * @return the message in green for a schema, red for an error document.
     */
    public String toAnsiString() {
        return (success ? GREEN : RED) + message + RESET;
    }
}
