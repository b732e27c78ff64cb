package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * A WSDL to fetch, typically a service URL ending in {@code ?wsdl}.
 *
 * @param wsdlUrl Absolute http(s) URL of the WSDL.
 */
public record WsdlUrlRequest(String wsdlUrl) implements AnalysisRequest {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.WSDL_URL;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(AnalysisRequest.requireHttpUrl(wsdlUrl, "wsdlUrl"));
    }
}
