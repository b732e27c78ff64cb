package com.resurrector.http;

import com.resurrector.model.AuthType;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.springframework.http.HttpHeaders;

/**
 * Builds outbound authentication headers.
 */
public final class AuthHeaders {

    public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    private AuthHeaders() {
    }

    /**
     * Adds the auth header, then the caller's custom headers, which win on a name clash.
     */
    public static void apply(HttpHeaders headers, AuthType type, String value, String apiKeyHeader,
                             Map<String, String> customHeaders) {
        switch (type) {
            case BEARER -> headers.setBearerAuth(value.trim());
            case API_KEY -> headers.set(apiKeyHeader == null || apiKeyHeader.isBlank()
                    ? DEFAULT_API_KEY_HEADER : apiKeyHeader.trim(), value.trim());
            case BASIC -> headers.set(HttpHeaders.AUTHORIZATION, basic(value));
            case NONE -> {
            }
            default -> throw new IllegalArgumentException("Auth type " + type + " cannot be sent as an HTTP header");
        }
        if (customHeaders != null) {
            customHeaders.forEach(headers::set);
        }
    }

    /**
     * @param credentials {@code user:password}.
     * @return the {@code Basic ...} header value.
     */
    public static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    public static String basic(String username, String password) {
        return basic(username + ":" + (password == null ? "" : password));
    }

    /**
     * Header names only, for logging; values never leave this process in logs.
     */
    public static String describe(HttpHeaders headers) {
        return String.join(", ", headers.keySet());
    }
}
