package com.resurrector.http;

import java.util.List;
import java.util.Locale;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Makes URLs safe to print: user-info is dropped and secret-looking query values are masked.
 */
public final class UrlRedactor {

    static final String MASK = "****";

    private static final List<String> SECRET_MARKERS =
            List.of("token", "key", "secret", "pass", "pwd", "auth", "signature", "sig", "credential");

    private UrlRedactor() {
    }

    public static String redact(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            UriComponents original = UriComponentsBuilder.fromUriString(url.trim()).build();
            UriComponentsBuilder redacted = UriComponentsBuilder.fromUriString(url.trim()).userInfo(null);
            MultiValueMap<String, String> params = original.getQueryParams();
            if (!params.isEmpty()) {
                redacted.replaceQuery(null);
                params.forEach((name, values) -> values.forEach(value ->
                        redacted.queryParam(name, isSecret(name) && value != null ? MASK : value)));
            }
            return redacted.build().toUriString();
        } catch (IllegalArgumentException e) {
            return "<unparseable url>";
        }
    }

    static boolean isSecret(String parameterName) {
        String lower = parameterName.toLowerCase(Locale.ROOT);
        return SECRET_MARKERS.stream().anyMatch(lower::contains);
    }
}
