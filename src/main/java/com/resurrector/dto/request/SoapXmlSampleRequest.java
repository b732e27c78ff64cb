package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import java.util.List;

/**
 * A captured SOAP response envelope.
 *
 * @param sampleXml     The response XML.
 * @param operationName The operation that produced it, e.g. {@code GetCustomers}.
 * @param endpointUrl   Optional service URL, used as the resource endpoint.
 */
public record SoapXmlSampleRequest(String sampleXml, String operationName, String endpointUrl)
        implements AnalysisRequest {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.SOAP_XML_SAMPLE;
    }

    @Override
    public List<String> problems() {
        return AnalysisRequest.collect(
                AnalysisRequest.requireText(sampleXml, "sampleXml"),
                AnalysisRequest.requireText(operationName, "operationName"));
    }
}
