package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * An inline WSDL 1.1 document.
 *
 * @param wsdlContent The WSDL XML.
 */
public record WsdlRequest(String wsdlContent) implements AnalysisRequest {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.WSDL;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(AnalysisRequest.requireText(wsdlContent, "wsdlContent"));
    }
}
