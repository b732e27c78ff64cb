package com.resurrector.dto.request;

import com.resurrector.exception.AnalysisException;
import com.resurrector.model.AnalysisMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * One analysis request. Each permitted record carries exactly the fields its {@link AnalysisMode}
 * needs, and checks them in {@link #validate()} before any analyzer runs.
 */
public sealed interface AnalysisRequest
        permits OpenApiSpecRequest, OpenApiUrlRequest, EndpointRequest, JsonSampleRequest,
                WsdlRequest, WsdlUrlRequest, SoapEndpointRequest, SoapXmlSampleRequest {

    AnalysisMode mode();

    /**
     * Lists every problem with the mode-required fields of this request.
     *
     * @return human-readable problems, empty when the request is complete.
     */
    List<String> problems();

    /**
     * @throws AnalysisException with {@code INVALID_INPUT} naming all problems at once.
     */
    default void validate() {
        List<String> problems = problems();
        if (!problems.isEmpty()) {
            throw AnalysisException.invalidInput(String.join("; ", problems) + " (mode " + mode().tag() + ")");
        }
    }

    static List<String> collect(String... problems) {
        List<String> found = new ArrayList<>();
        for (String problem : problems) {
            if (problem != null) {
                found.add(problem);
            }
        }
        return found;
    }

    static String requireText(String value, String field) {
        return value == null || value.isBlank() ? field + " is required" : null;
    }

    static String requireHttpUrl(String value, String field) {
        String missing = requireText(value, field);
        if (missing != null) {
            return missing;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return field + " must be an absolute http(s) URL";
            }
            return null;
        } catch (URISyntaxException e) {
            return field + " is not a valid URL";
        }
    }
}
