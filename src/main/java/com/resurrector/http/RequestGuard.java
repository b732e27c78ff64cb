package com.resurrector.http;

import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Wraps every outbound fetch with a wall-clock timeout and a byte ceiling.
 * <p>
 * The ceiling is enforced while the body streams in, so an oversized body is abandoned as soon as
 * it crosses the limit rather than after it has been buffered. A declared {@code Content-Length}
 * above the ceiling aborts before any body byte is read. There are no retries.
 */
@Slf4j
@Getter
public class RequestGuard {

    private static final long MEGABYTE = 1024L * 1024L;

    private final WebClient webClient;
    private final Duration timeout;
    private final long maxBytes;

    public RequestGuard(WebClient webClient, Duration timeout, long maxBytes) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.webClient = webClient;
        this.timeout = timeout;
        this.maxBytes = maxBytes;
    }

    public FetchedResponse get(String url, Consumer<HttpHeaders> headers) {
        return fetch(HttpMethod.GET, url, headers, null, null);
    }

    /**
     * Performs exactly one HTTP exchange.
     *
     * @param method      The HTTP method.
     * @param url         The absolute target URL.
     * @param headers     Callback adding request headers.
     * @param body        An optional request body; null sends none.
     * @param contentType The body media type, ignored without a body.
     * @return the buffered response, whatever its status.
     * @throws AnalysisException {@code INVALID_INPUT} for a malformed URL, else {@code TIMEOUT},
     *                           {@code PAYLOAD_TOO_LARGE} or {@code UNREACHABLE}.
     */
    public FetchedResponse fetch(HttpMethod method, String url, Consumer<HttpHeaders> headers,
                                 String body, MediaType contentType) {
        String redacted = UrlRedactor.redact(url);
        URI target;
        try {
            target = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw AnalysisException.invalidInput("Target URL " + redacted + " is not a valid URI");
        }
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(target)
                .headers(headers);
        WebClient.RequestHeadersSpec<?> ready = spec;
        if (body != null) {
            ready = spec.contentType(contentType != null ? contentType : MediaType.TEXT_PLAIN)
                    .bodyValue(body);
        }
        log.info("{} {} (timeout {}, limit {})", method, redacted, describe(timeout), describeSize(maxBytes));
        try {
            FetchedResponse response = ready.exchangeToMono(r -> readBounded(r, redacted))
                    .timeout(timeout)
                    .block();
            log.info("{} {} answered HTTP {} with {} bytes", method, redacted, response.status(), response.body().length);
            return response;
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e), redacted);
        }
    }

    /**
     * Applies the same ceiling to text supplied inline by the caller.
     *
     * @throws AnalysisException {@code PAYLOAD_TOO_LARGE} when the UTF-8 encoding exceeds the ceiling.
     */
    public void checkInlineSize(String text, String what) {
        if (text != null) {
            checkInlineSize(text.getBytes(StandardCharsets.UTF_8).length, what);
        }
    }

    /**
     * Checks a size known up front, such as that of a file, before anything is read.
     */
    public void checkInlineSize(long bytes, String what) {
        if (bytes > maxBytes) {
            throw new AnalysisException(ErrorKind.PAYLOAD_TOO_LARGE,
                    "Inline " + what + " exceeds the " + describeSize(maxBytes) + " limit");
        }
    }

    private Mono<FetchedResponse> readBounded(ClientResponse response, String redacted) {
        long declared = response.headers().contentLength().orElse(-1L);
        if (declared > maxBytes) {
            return response.releaseBody().then(Mono.error(tooLarge(redacted)));
        }
        int limit = (int) Math.min(maxBytes, Integer.MAX_VALUE);
        MediaType mediaType = response.headers().contentType().orElse(null);
        int status = response.statusCode().value();
        return DataBufferUtils.join(response.bodyToFlux(DataBuffer.class), limit)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new FetchedResponse(status, mediaType, bytes));
    }

    private RuntimeException translate(Throwable failure, String redacted) {
        if (failure instanceof AnalysisException analysisException) {
            return analysisException;
        }
        if (failure instanceof TimeoutException) {
            return new AnalysisException(ErrorKind.TIMEOUT,
                    "Request to " + redacted + " did not complete within " + describe(timeout), failure);
        }
        if (failure instanceof DataBufferLimitException) {
            return tooLarge(redacted);
        }
        if (failure instanceof WebClientRequestException || failure instanceof IOException) {
            Throwable root = failure.getCause() != null ? failure.getCause() : failure;
            return new AnalysisException(ErrorKind.UNREACHABLE,
                    "Could not reach " + redacted + ": " + root.getClass().getSimpleName(), failure);
        }
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException(failure);
    }

    private AnalysisException tooLarge(String redacted) {
        return new AnalysisException(ErrorKind.PAYLOAD_TOO_LARGE,
                "Response from " + redacted + " exceeds the " + describeSize(maxBytes) + " limit");
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    static String describeSize(long bytes) {
        return bytes % MEGABYTE == 0 ? (bytes / MEGABYTE) + " MB" : bytes + " bytes";
    }
}
