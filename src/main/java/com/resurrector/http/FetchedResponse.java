package com.resurrector.http;

import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;

/**
 * A fully buffered response that stayed within the configured size ceiling.
 *
 * @param status      The HTTP status code.
 * @param contentType The response media type, or null when the server sent none.
 * @param body        The raw body bytes, empty when there was no body.
 */
public record FetchedResponse(int status, MediaType contentType, byte[] body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        return new String(body, charset);
    }

    /**
     * Turns a non-success status into the matching failure.
     *
     * @param redactedUrl The target, already stripped of credentials, for the message.
     * @return this response, when the status is 2xx.
     * @throws AnalysisException {@code AUTH_FAILURE} for 401/403, {@code UPSTREAM_ERROR} otherwise.
     */
    public FetchedResponse ensureSuccess(String redactedUrl) {
        if (isSuccess()) {
            return this;
        }
        if (status == 401 || status == 403) {
            throw new AnalysisException(ErrorKind.AUTH_FAILURE,
                    "Target " + redactedUrl + " rejected the supplied credentials (HTTP " + status + ")");
        }
        throw new AnalysisException(ErrorKind.UPSTREAM_ERROR,
                "Target " + redactedUrl + " answered HTTP " + status);
    }
}
