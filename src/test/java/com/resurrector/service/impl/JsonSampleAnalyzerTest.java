package com.resurrector.service.impl;

import com.resurrector.dto.request.JsonSampleRequest;
import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import com.resurrector.http.RequestGuard;
import com.resurrector.model.ObservedCall;
import com.resurrector.model.RawResource;
import com.resurrector.model.ResourceSchema;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSampleAnalyzerTest {

    private JsonSampleAnalyzer jsonSampleAnalyzer;

    @BeforeEach
    void setUp() {
        RequestGuard requestGuard = new RequestGuard(WebClient.builder().build(), Duration.ofSeconds(1), 128);
        jsonSampleAnalyzer = new JsonSampleAnalyzer(new FormatReaderImpl(), requestGuard);
    }

    @Test
    void analyze_shouldUseSampleDefaultsWithoutPath() {
        RawResource resource = jsonSampleAnalyzer.analyze(new JsonSampleRequest("[{\"id\":1,\"name\":\"Jane\"}]")).get(0);

        assertThat(resource.getName()).isEqualTo(JsonSampleAnalyzer.SAMPLE_NAME);
        assertThat(resource.getEndpoint()).isEqualTo(ResourceSchema.SAMPLE_ENDPOINT);
        assertThat(resource.isFromSample()).isTrue();
        assertThat(resource.getObservedCalls()).isEmpty();
        assertThat(resource.getSamplePayload().isArray()).isTrue();
    }

    @Test
    void analyze_shouldNameResourceFromPathAndRecordMethod() {
        RawResource resource = jsonSampleAnalyzer.analyze(
                new JsonSampleRequest("{\"order_id\":9}", "/api/v2/orders/{order_id}", "get")).get(0);

        assertThat(resource.getName()).isEqualTo("orders");
        assertThat(resource.getEndpoint()).isEqualTo("/api/v2/orders/{order_id}");
        assertThat(resource.getObservedCalls()).containsExactly(new ObservedCall("GET", true));
    }

    @Test
    void analyze_shouldRejectMalformedJson() {
        assertThatThrownBy(() -> jsonSampleAnalyzer.analyze(new JsonSampleRequest("[{\"id\":1,}]")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageStartingWith("Invalid JSON sample: malformed JSON at line 1")
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    void analyze_shouldRejectSamplesAboveCeiling() {
        String big = "[" + "{\"id\":1},".repeat(40) + "{\"id\":2}]";

        assertThatThrownBy(() -> jsonSampleAnalyzer.analyze(new JsonSampleRequest(big)))
                .isInstanceOf(AnalysisException.class)
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.PAYLOAD_TOO_LARGE);
    }
}
