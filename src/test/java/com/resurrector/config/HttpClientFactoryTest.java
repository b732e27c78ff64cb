package com.resurrector.config;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;

class HttpClientFactoryTest {

    private MockWebServer mockWebServer;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void webClient_shouldIdentifyItselfAndFollowRedirects() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(302)
                .addHeader(HttpHeaders.LOCATION, mockWebServer.url("/moved").toString()));
        mockWebServer.enqueue(new MockResponse().setBody("ok"));
        WebClient webClient = new HttpClientFactory().webClient(5);

        String body = webClient.get().uri(mockWebServer.url("/start").uri())
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofSeconds(5));

        assertThat(body).isEqualTo("ok");
        RecordedRequest first = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest second = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(first.getHeader(HttpHeaders.USER_AGENT)).isEqualTo(HttpClientFactory.USER_AGENT);
        assertThat(second.getPath()).isEqualTo("/moved");
    }
}
