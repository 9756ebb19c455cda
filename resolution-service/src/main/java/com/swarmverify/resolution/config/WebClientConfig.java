package com.swarmverify.resolution.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmverify.resolution.ai.GeminiReasoningClient;
import com.swarmverify.resolution.ai.ReasoningClient;
import com.swarmverify.resolution.search.InstantAnswerClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    // ── Primary reasoning backend ────────────────────────────────────────────
    @Value("${swarm.reasoning.base-url:https://generativelanguage.googleapis.com}")
    private String reasoningBaseUrl;

    @Value("${swarm.reasoning.api-key:}")
    private String reasoningApiKey;

    @Value("${swarm.reasoning.model:gemini-1.5-pro}")
    private String reasoningModel;

    @Value("${swarm.reasoning.max-retries:2}")
    private int maxRetries;

    @Value("${swarm.reasoning.retry-backoff-ms:2000}")
    private long retryBackoffMs;

    // ── Investigator (search-grounded, separate key) ─────────────────────────
    @Value("${swarm.investigator.api-key:}")
    private String investigatorApiKey;

    @Value("${swarm.investigator.model:gemini-2.5-flash}")
    private String investigatorModel;

    // ── Instant-answer search ────────────────────────────────────────────────
    @Value("${swarm.search.base-url:https://api.duckduckgo.com}")
    private String searchBaseUrl;

    @Value("${swarm.search.enabled:true}")
    private boolean searchEnabled;

    @Bean
    public WebClient reasoningWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(reasoningBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(30)))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient searchWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(searchBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(10)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    @Primary
    public ReasoningClient reasoningClient(@Qualifier("reasoningWebClient") WebClient reasoningWebClient,
                                           ObjectMapper objectMapper) {
        if (reasoningApiKey == null || reasoningApiKey.isBlank()) {
            log.warn("[Config] swarm.reasoning.api-key not set. Resolution requests will be rejected with 503.");
        }
        return new GeminiReasoningClient(reasoningWebClient, objectMapper, reasoningApiKey,
            reasoningModel, maxRetries, Duration.ofMillis(retryBackoffMs));
    }

    @Bean
    public ReasoningClient investigatorReasoningClient(@Qualifier("reasoningWebClient") WebClient reasoningWebClient,
                                                       ObjectMapper objectMapper) {
        return new GeminiReasoningClient(reasoningWebClient, objectMapper, investigatorApiKey,
            investigatorModel, maxRetries, Duration.ofMillis(retryBackoffMs));
    }

    @Bean
    public InstantAnswerClient instantAnswerClient(@Qualifier("searchWebClient") WebClient searchWebClient,
                                                   ObjectMapper objectMapper) {
        return new InstantAnswerClient(searchWebClient, objectMapper, searchEnabled);
    }

    private HttpClient httpClient(int readTimeoutSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("key=[^&]+", "key=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
