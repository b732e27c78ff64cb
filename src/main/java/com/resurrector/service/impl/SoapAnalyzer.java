package com.resurrector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.request.SoapEndpointRequest;
import com.resurrector.dto.request.SoapXmlSampleRequest;
import com.resurrector.dto.request.WsdlRequest;
import com.resurrector.dto.request.WsdlUrlRequest;
import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import com.resurrector.exception.FormatException;
import com.resurrector.http.AuthHeaders;
import com.resurrector.http.FetchedResponse;
import com.resurrector.http.RequestGuard;
import com.resurrector.http.UrlRedactor;
import com.resurrector.inference.ResourceNames;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.AuthType;
import com.resurrector.model.RawResource;
import com.resurrector.model.ResourceSchema;
import com.resurrector.service.api.FormatReader;
import com.resurrector.service.api.ResourceAnalyzer;
import com.resurrector.soap.SoapEnvelopes;
import com.resurrector.soap.SoapFault;
import com.resurrector.soap.WsdlDescription;
import com.resurrector.soap.WsdlReader;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Handles every SOAP flavour: WSDL documents (inline or fetched), a live SOAP endpoint, and a
 * captured SOAP response.
 * <p>
 * WSDL input yields declared fields and operation names. Envelope input is converted to a JSON tree
 * and normalized exactly like a JSON sample.
 */
@Service
@Slf4j
public class SoapAnalyzer implements ResourceAnalyzer {

    private static final List<String> MESSAGE_TYPE_MARKERS = List.of("request", "response", "result", "message");
    private static final MediaType SOAP_XML = MediaType.parseMediaType("text/xml; charset=utf-8");

    private final FormatReader formatReader;
    private final RequestGuard requestGuard;

    public SoapAnalyzer(FormatReader formatReader, RequestGuard requestGuard) {
        this.formatReader = formatReader;
        this.requestGuard = requestGuard;
    }

    @Override
    public Set<AnalysisMode> modes() {
        return EnumSet.of(AnalysisMode.WSDL, AnalysisMode.WSDL_URL, AnalysisMode.SOAP_ENDPOINT,
                AnalysisMode.SOAP_XML_SAMPLE);
    }

    @Override
    public List<RawResource> analyze(AnalysisRequest request) {
        if (request instanceof WsdlRequest wsdl) {
            requestGuard.checkInlineSize(wsdl.wsdlContent(), "WSDL document");
            return fromWsdl(wsdl.wsdlContent());
        }
        if (request instanceof WsdlUrlRequest wsdlUrl) {
            FetchedResponse response = requestGuard.get(wsdlUrl.wsdlUrl(),
                    headers -> headers.set(HttpHeaders.ACCEPT, "text/xml, application/xml, */*"));
            response.ensureSuccess(UrlRedactor.redact(wsdlUrl.wsdlUrl()));
            return fromWsdl(response.bodyAsString());
        }
        if (request instanceof SoapXmlSampleRequest sample) {
            requestGuard.checkInlineSize(sample.sampleXml(), "SOAP sample");
            Element body = SoapEnvelopes.body(readXml(sample.sampleXml(), "SOAP sample"));
            Optional<SoapFault> fault = SoapEnvelopes.fault(body);
            if (fault.isPresent()) {
                throw AnalysisException.invalidInput("SOAP sample is a fault, not a response: " + fault.get());
            }
            String operation = sample.operationName().trim();
            return List.of(fromEnvelope(body, operation, endpointPath(sample.endpointUrl())));
        }
        if (request instanceof SoapEndpointRequest endpoint) {
            return fromEndpoint(endpoint);
        }
        throw new IllegalArgumentException("SoapAnalyzer cannot handle mode " + request.mode());
    }

    private List<RawResource> fromWsdl(String text) {
        WsdlDescription description;
        try {
            description = WsdlReader.read(formatReader.readXml(text));
        } catch (FormatException e) {
            throw e.toAnalysisException("WSDL document");
        }

        List<WsdlDescription.ComplexType> candidates = description.types().stream()
                .filter(type -> !isMessageType(type.name()))
                .toList();
        if (candidates.isEmpty()) {
            candidates = description.types();
        }

        List<RawResource> resources = new ArrayList<>();
        for (WsdlDescription.ComplexType type : candidates) {
            RawResource resource = RawResource.named(
                    ResourceNames.pluralize(ResourceNames.toSnakeCase(type.name())), description.endpointPath());
            type.fields().forEach(resource::declareField);
            resource.getSoapOperations().addAll(attributedOperations(type, description));
            resources.add(resource);
        }
        log.info("WSDL service '{}' yielded {} resource(s) and {} operation(s)",
                description.serviceName(), resources.size(), description.operations().size());
        return resources;
    }

    /**
     * Operations whose messages carry the type (directly or through a wrapper element), or whose name
     * mentions it. A type no operation claims gets every operation of the service.
     */
    private static List<String> attributedOperations(WsdlDescription.ComplexType type, WsdlDescription description) {
        String singular = ResourceNames.singularize(type.name().toLowerCase(Locale.ROOT));
        Set<String> claimed = new LinkedHashSet<>();
        for (WsdlDescription.Operation operation : description.operations()) {
            if (carries(operation, type, description) || operation.name().toLowerCase(Locale.ROOT).contains(singular)) {
                claimed.add(operation.name());
            }
        }
        if (claimed.isEmpty()) {
            description.operations().forEach(operation -> claimed.add(operation.name()));
        }
        return List.copyOf(claimed);
    }

    private static boolean carries(WsdlDescription.Operation operation, WsdlDescription.ComplexType type,
                                   WsdlDescription description) {
        for (String carried : operation.messageTypes()) {
            if (carried.equals(type.name())) {
                return true;
            }
            boolean wraps = description.types().stream()
                    .anyMatch(wrapper -> wrapper.name().equals(carried) && wrapper.referencedTypes().contains(type.name()));
            if (wraps) {
                return true;
            }
        }
        return false;
    }

    private static boolean isMessageType(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return MESSAGE_TYPE_MARKERS.stream().anyMatch(lower::contains);
    }

    private List<RawResource> fromEndpoint(SoapEndpointRequest request) {
        String url = request.endpointUrl().trim();
        String redacted = UrlRedactor.redact(url);
        String operation = SoapEnvelopes.operationFromAction(request.soapAction());
        if (!SoapEnvelopes.isElementName(operation)) {
            throw AnalysisException.invalidInput("SOAPAction '" + request.soapAction().trim()
                    + "' does not end in an operation name");
        }
        AuthType authType = AuthType.parse(request.authType());

        String envelope = SoapEnvelopes.request(operation, SoapEnvelopes.namespaceFromAction(request.soapAction()),
                authType == AuthType.WSSE ? request.username() : null,
                authType == AuthType.WSSE ? request.password() : null);
        FetchedResponse response = requestGuard.fetch(HttpMethod.POST, url, headers -> {
            headers.set("SOAPAction", "\"" + request.soapAction().trim().replace("\"", "") + "\"");
            headers.set(HttpHeaders.ACCEPT, "text/xml, application/soap+xml");
            if (authType == AuthType.BASIC) {
                headers.set(HttpHeaders.AUTHORIZATION, AuthHeaders.basic(request.username(), request.password()));
            }
            log.debug("Sending headers [{}] to {}", AuthHeaders.describe(headers), redacted);
        }, envelope, SOAP_XML);

        Document document = null;
        if (response.body().length > 0) {
            try {
                document = formatReader.readXml(response.bodyAsString());
            } catch (FormatException e) {
                response.ensureSuccess(redacted);
                throw e.toAnalysisException("SOAP response from " + redacted);
            }
        }
        if (document != null) {
            Optional<SoapFault> fault = SoapEnvelopes.fault(SoapEnvelopes.body(document));
            if (fault.isPresent()) {
                throw new AnalysisException(ErrorKind.UPSTREAM_ERROR,
                        "SOAP fault from " + redacted + ": " + fault.get());
            }
        }
        response.ensureSuccess(redacted);
        if (document == null) {
            throw AnalysisException.noResources("SOAP endpoint " + redacted + " returned an empty body");
        }
        return List.of(fromEnvelope(SoapEnvelopes.body(document), operation, endpointPath(url)));
    }

    private RawResource fromEnvelope(Element body, String operation, String endpoint) {
        JsonNode payload = SoapEnvelopes.payload(body, operation);
        RawResource resource = RawResource.named(ResourceNames.fromOperationName(operation), endpoint);
        resource.setSamplePayload(payload);
        resource.setFromSample(true);
        resource.getSoapOperations().add(operation);
        return resource;
    }

    private Document readXml(String text, String what) {
        try {
            return formatReader.readXml(text);
        } catch (FormatException e) {
            throw e.toAnalysisException(what);
        }
    }

    private static String endpointPath(String url) {
        if (url == null || url.isBlank()) {
            return ResourceSchema.SAMPLE_ENDPOINT;
        }
        try {
            String path = new URI(url.trim()).getPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (URISyntaxException e) {
            log.warn("Ignoring unparseable endpoint URL {}", UrlRedactor.redact(url));
            return ResourceSchema.SAMPLE_ENDPOINT;
        }
    }
}
