package com.resurrector.dto.request;

import com.resurrector.model.AnalysisMode;
import com.resurrector.model.AuthType;
import com.resurrector.soap.SoapEnvelopes;
import java.util.List;

/**
 * A live SOAP endpoint to invoke once with a generated envelope.
 *
 * @param endpointUrl The service URL the envelope is posted to.
 * @param soapAction  The SOAPAction URI; its segment after the last {@code /}, {@code #} or {@code :} names the operation.
 * @param authType    none, basic or wsse.
 * @param username    User for basic or WS-Security auth.
 * @param password    Password for basic or WS-Security auth.
 */
public record SoapEndpointRequest(
        String endpointUrl,
        String soapAction,
        String authType,
        String username,
        String password
) implements AnalysisRequest {

    public SoapEndpointRequest(String endpointUrl, String soapAction) {
        this(endpointUrl, soapAction, null, null, null);
    }

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.SOAP_ENDPOINT;
    }

    @Override
    public List<String> problems() {
        List<String> problems = AnalysisRequest.collect(
                AnalysisRequest.requireHttpUrl(endpointUrl, "endpointUrl"),
                AnalysisRequest.requireText(soapAction, "soapAction"));
        if (soapAction != null && !soapAction.isBlank()
                && !SoapEnvelopes.isElementName(SoapEnvelopes.operationFromAction(soapAction))) {
            problems.add("soapAction must end in an operation name, got '" + soapAction.trim() + "'");
        }
        try {
            AuthType type = AuthType.parse(authType);
            if (type == AuthType.BEARER || type == AuthType.API_KEY) {
                problems.add("authType " + authType + " is not supported for soap_endpoint");
            } else if (type != AuthType.NONE && (username == null || username.isBlank() || password == null)) {
                problems.add("username and password are required for authType " + authType);
            }
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        return problems;
    }

    @Override
    public String toString() {
        return "SoapEndpointRequest[endpointUrl=" + endpointUrl + ", soapAction=" + soapAction
                + ", authType=" + authType + "]";
    }
}
