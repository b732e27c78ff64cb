package com.resurrector.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.resurrector.cli.ui.Spinner;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.request.EndpointRequest;
import com.resurrector.dto.request.JsonSampleRequest;
import com.resurrector.dto.request.OpenApiSpecRequest;
import com.resurrector.dto.request.OpenApiUrlRequest;
import com.resurrector.dto.request.SoapEndpointRequest;
import com.resurrector.dto.request.SoapXmlSampleRequest;
import com.resurrector.dto.request.WsdlRequest;
import com.resurrector.dto.request.WsdlUrlRequest;
import com.resurrector.dto.response.AnalysisResponse;
import com.resurrector.dto.response.CommandResponse;
import com.resurrector.dto.response.ErrorResponse;
import com.resurrector.exception.AnalysisException;
import com.resurrector.http.RequestGuard;
import com.resurrector.model.AnalysisMode;
import com.resurrector.service.api.SchemaNormalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component exposing the analysis engine as the {@code analyze} command.
 * It assembles one request from the options, runs it, and prints either the
 * {@code {"resources": [...]}} document or an {@code {"error": {...}}} document.
 */
@ShellComponent
public class AnalyzeCommand {

    private final SchemaNormalizer schemaNormalizer;
    private final Spinner spinner;
    private final RequestGuard requestGuard;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public AnalyzeCommand(SchemaNormalizer schemaNormalizer, Spinner spinner, RequestGuard requestGuard) {
        this.schemaNormalizer = schemaNormalizer;
        this.spinner = spinner;
        this.requestGuard = requestGuard;
    }

    /**
     * Infers a resource schema from one API description.
     *
     * @param mode         One of openapi, openapi_url, endpoint, json_sample, wsdl, wsdl_url, soap_endpoint, soap_xml_sample.
     * @param input        Inline document text (openapi, json_sample, wsdl, soap_xml_sample).
     * @param file         A file to read the document text from instead of {@code --input}.
     * @param url          Spec or WSDL URL, SOAP endpoint URL, or the service URL of a SOAP sample.
     * @param baseUrl      Base URL of a live REST endpoint.
     * @param path         Endpoint path of a live endpoint or JSON sample.
     * @param method       HTTP method of a live endpoint or JSON sample.
     * @param authType     none, bearer, api-key, basic or wsse.
     * @param authValue    Token, api key, or user:password.
     * @param apiKeyHeader Header carrying the api key.
     * @param headers      Extra headers as {@code "Name: value; Other: value"}.
     * @param soapAction   SOAPAction of a live SOAP endpoint.
     * @param operation    Operation that produced a SOAP sample.
     * @param username     SOAP user.
     * @param password     SOAP password.
     * @param verbose      If true, enables debug logging for the duration of the command.
     * @return the rendered result, colored green on success and red on failure.
     */
    @ShellMethod(key = "analyze", value = "Infers a normalized resource schema from an API description.")
    public String analyze(
            @ShellOption(value = {"--mode", "-m"}, help = "The input mode.") String mode,
            @ShellOption(value = {"--input", "-i"}, help = "Inline document text.", defaultValue = ShellOption.NULL) String input,
            @ShellOption(value = {"--file", "-f"}, help = "Read the document text from this file.", defaultValue = ShellOption.NULL) String file,
            @ShellOption(value = {"--url", "-u"}, help = "Spec, WSDL or SOAP endpoint URL.", defaultValue = ShellOption.NULL) String url,
            @ShellOption(value = "--base-url", help = "Base URL of a live endpoint.", defaultValue = ShellOption.NULL) String baseUrl,
            @ShellOption(value = {"--path", "-p"}, help = "Endpoint path.", defaultValue = ShellOption.NULL) String path,
            @ShellOption(value = "--method", help = "HTTP method (GET or POST).", defaultValue = ShellOption.NULL) String method,
            @ShellOption(value = "--auth-type", help = "none, bearer, api-key, basic or wsse.", defaultValue = ShellOption.NULL) String authType,
            @ShellOption(value = "--auth-value", help = "Token, key, or user:password.", defaultValue = ShellOption.NULL) String authValue,
            @ShellOption(value = "--api-key-header", help = "Header carrying the api key.", defaultValue = ShellOption.NULL) String apiKeyHeader,
            @ShellOption(value = "--headers", help = "Extra headers, e.g. \"X-Tenant: acme; X-Trace: 1\".", defaultValue = ShellOption.NULL) String headers,
            @ShellOption(value = "--soap-action", help = "SOAPAction of a live SOAP endpoint.", defaultValue = ShellOption.NULL) String soapAction,
            @ShellOption(value = "--operation", help = "Operation that produced a SOAP sample.", defaultValue = ShellOption.NULL) String operation,
            @ShellOption(value = "--username", help = "SOAP user.", defaultValue = ShellOption.NULL) String username,
            @ShellOption(value = "--password", help = "SOAP password.", defaultValue = ShellOption.NULL) String password,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
        try {
            AnalysisMode analysisMode = AnalysisMode.fromTag(mode).orElseThrow(() -> AnalysisException.invalidInput(
                    "Unknown mode '" + mode + "'; expected one of " + Arrays.stream(AnalysisMode.values())
                            .map(AnalysisMode::tag).collect(Collectors.joining(", "))));
            String text = file != null ? readFile(file) : input;
            AnalysisRequest request = switch (analysisMode) {
                case OPENAPI -> new OpenApiSpecRequest(text);
                case OPENAPI_URL -> new OpenApiUrlRequest(url);
                case ENDPOINT -> new EndpointRequest(baseUrl, path, method, authType, authValue, apiKeyHeader,
                        parseHeaders(headers));
                case JSON_SAMPLE -> new JsonSampleRequest(text, path, method);
                case WSDL -> new WsdlRequest(text);
                case WSDL_URL -> new WsdlUrlRequest(url);
                case SOAP_ENDPOINT -> new SoapEndpointRequest(url, soapAction, authType, username, password);
                case SOAP_XML_SAMPLE -> new SoapXmlSampleRequest(text, operation, url);
            };
            AnalysisResponse response = spinner.spin("Analyzing...", () -> schemaNormalizer.analyze(request));
            return CommandResponse.schema(render(response)).toAnsiString();
        } catch (AnalysisException e) {
            return CommandResponse.failure(render(ErrorResponse.of(e))).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }

    /**
     * Parses {@code "Name: value; Other: value"} into an ordered header map.
     */
    static Map<String, String> parseHeaders(String headers) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (headers == null || headers.isBlank()) {
            return parsed;
        }
        for (String entry : headers.split(";")) {
            if (entry.isBlank()) {
                continue;
            }
            int colon = entry.indexOf(':');
            if (colon <= 0) {
                throw AnalysisException.invalidInput("Header '" + entry.trim() + "' must look like Name: value");
            }
            parsed.put(entry.substring(0, colon).trim(), entry.substring(colon + 1).trim());
        }
        return parsed;
    }

    private String readFile(String file) {
        try {
            Path path = Path.of(file);
            requestGuard.checkInlineSize(Files.size(path), "input file " + file);
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw AnalysisException.invalidInput("Cannot read input file " + file + ": " + e.getClass().getSimpleName());
        }
    }

    private String render(Object document) {
        try {
            return jsonMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render analysis result", e);
        }
    }
}
