package com.resurrector.dto.request;

import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisRequestTest {

    @Test
    void validate_shouldListEveryProblemAtOnce() {
        assertThatThrownBy(() -> new SoapXmlSampleRequest(" ", null, null).validate())
                .isInstanceOf(AnalysisException.class)
                .hasMessage("sampleXml is required; operationName is required (mode soap_xml_sample)")
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    void problems_shouldRequireAbsoluteHttpUrls() {
        assertThat(new OpenApiUrlRequest("ftp://host/spec.json").problems())
                .containsExactly("specUrl must be an absolute http(s) URL");
        assertThat(new WsdlUrlRequest("not a url").problems()).hasSize(1);
        assertThat(new OpenApiUrlRequest("https://host/spec.json").problems()).isEmpty();
    }

    @Test
    void endpointProblems_shouldCheckMethodAndAuth() {
        assertThat(new EndpointRequest("https://host", "/users", "DELETE", null, null, null, null).problems())
                .containsExactly("method must be GET or POST, was DELETE");
        assertThat(new EndpointRequest("https://host", "/users", null, "bearer", " ", null, null).problems())
                .containsExactly("authValue is required for authType bearer");
        assertThat(new EndpointRequest("https://host", "/users", null, "basic", "nocolon", null, null).problems())
                .containsExactly("authValue for basic auth must look like user:password");
        assertThat(new EndpointRequest("https://host", "/users", null, "wsse", "x", null, null).problems())
                .containsExactly("authType wsse is only supported for soap_endpoint");
        assertThat(new EndpointRequest("https://host", "/users", null, "oauth", "x", null, null).problems())
                .containsExactly("Unsupported auth type: oauth");
    }

    @Test
    void soapEndpointProblems_shouldRejectHeaderOnlyAuth() {
        assertThat(new SoapEndpointRequest("https://host/svc", "urn:Get", "bearer", "u", "p").problems())
                .containsExactly("authType bearer is not supported for soap_endpoint");
        assertThat(new SoapEndpointRequest("https://host/svc", "urn:Get", "wsse", null, null).problems())
                .containsExactly("username and password are required for authType wsse");
        assertThat(new SoapEndpointRequest("https://host/svc", "urn:Get").problems()).isEmpty();
    }

    @Test
    void toString_shouldNotExposeCredentials() {
        EndpointRequest endpoint = new EndpointRequest("https://host", "/users", null, "bearer", "tok-secret", null,
                Map.of("X-Api-Token", "hdr-secret"));
        SoapEndpointRequest soap = new SoapEndpointRequest("https://host/svc", "urn:Get", "basic", "u", "pw-secret");

        assertThat(endpoint.toString()).doesNotContain("tok-secret").doesNotContain("hdr-secret").contains("X-Api-Token");
        assertThat(soap.toString()).doesNotContain("pw-secret");
    }

    @Test
    void effectiveMethod_shouldDefaultToGet() {
        assertThat(new EndpointRequest("https://host", "/users").effectiveMethod()).isEqualTo("GET");
        assertThat(new EndpointRequest("https://host", "/users", " post ", null, null, null, null).effectiveMethod())
                .isEqualTo("POST");
    }

    @Test
    void endpointProblems_shouldRejectPathThatIsNotAUrl() {
        assertThat(new EndpointRequest("https://host", "/users/{id}").problems())
                .singleElement().asString().contains("endpointPath must be a concrete URL path");
        assertThat(new EndpointRequest("https://host", "/users?q=a b").problems()).hasSize(1);
        assertThat(new EndpointRequest("https://host", "/users/42?page=2").problems()).isEmpty();
    }

    @Test
    void soapEndpointProblems_shouldRequireOperationNameInAction() {
        assertThat(new SoapEndpointRequest("https://host/svc", "http://tempuri.org/").problems())
                .singleElement().asString().contains("soapAction must end in an operation name");
        assertThat(new SoapEndpointRequest("https://host/svc", "urn:example:GetCustomers").problems()).isEmpty();
    }
}
