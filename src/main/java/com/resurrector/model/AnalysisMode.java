package com.resurrector.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Input-format selector that decides which analyzer handles a request.
 */
public enum AnalysisMode {
    OPENAPI("openapi"),
    OPENAPI_URL("openapi_url"),
    ENDPOINT("endpoint"),
    JSON_SAMPLE("json_sample"),
    WSDL("wsdl"),
    WSDL_URL("wsdl_url"),
    SOAP_ENDPOINT("soap_endpoint"),
    SOAP_XML_SAMPLE("soap_xml_sample");

    private final String tag;

    AnalysisMode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<AnalysisMode> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(mode -> mode.tag.equals(normalized)).findFirst();
    }
}
