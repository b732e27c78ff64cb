package com.resurrector.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating the outbound HTTP client.
 * <p>
 * Failed calls are never retried here; a failure is reported to the caller as it happened.
 */
@Configuration
public class HttpClientFactory {

    static final String USER_AGENT = "api-resurrector-analyzer";

    /**
     * Creates the shared WebClient bean on a Reactor Netty connector that follows redirects.
     * The connect timeout matches the analysis timeout; the overall deadline and the body size
     * ceiling are applied per call by {@link com.resurrector.http.RequestGuard}.
     *
     * @param timeoutSeconds The configured analysis timeout.
     * @return A configured {@link WebClient} instance.
     */
    @Bean
    public WebClient webClient(@Value("${analyzer.timeout-seconds:30}") long timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, Duration.ofSeconds(timeoutSeconds).toMillis()));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }
}
