package com.resurrector.config;

import com.resurrector.http.RequestGuard;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Reads the analysis limits once at startup.
 * <p>
 * {@code analyzer.timeout-seconds} (env {@code ANALYZER_TIMEOUT_SECONDS}, default 30) and
 * {@code analyzer.max-payload-mb} (env {@code ANALYZER_MAX_PAYLOAD_MB}, default 10).
 */
@Configuration
@Slf4j
public class AnalyzerConfig {

    private static final long MEGABYTE = 1024L * 1024L;

    @Bean
    public RequestGuard requestGuard(WebClient webClient,
                                     @Value("${analyzer.timeout-seconds:30}") long timeoutSeconds,
                                     @Value("${analyzer.max-payload-mb:10}") long maxPayloadMb) {
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("analyzer.timeout-seconds must be positive, was " + timeoutSeconds);
        }
        if (maxPayloadMb <= 0) {
            throw new IllegalStateException("analyzer.max-payload-mb must be positive, was " + maxPayloadMb);
        }
        log.info("Analysis limits: timeout {}s, payload ceiling {} MB", timeoutSeconds, maxPayloadMb);
        return new RequestGuard(webClient, Duration.ofSeconds(timeoutSeconds), maxPayloadMb * MEGABYTE);
    }
}
