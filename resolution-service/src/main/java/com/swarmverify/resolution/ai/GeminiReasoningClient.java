package com.swarmverify.resolution.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmverify.common.exception.ReasoningBackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningClient} backed by the Gemini {@code generateContent} REST endpoint.
 *
 * <p><strong>Reactive contract</strong>: no {@code .block()} anywhere. Cancelling the returned
 * {@code Mono} (for example through an upstream {@code timeout}) cancels the HTTP exchange.
 *
 * <p><strong>Retries</strong>: HTTP 503 / 429 and connection-level failures are retried with
 * exponential backoff up to {@code maxRetries} times. Any other status fails immediately.
 */
public class GeminiReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiReasoningClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxRetries;
    private final Duration retryBackoff;

    public GeminiReasoningClient(WebClient webClient, ObjectMapper objectMapper, String apiKey,
                                 String model, int maxRetries, Duration retryBackoff) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.model        = model;
        this.maxRetries   = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<String> generate(String prompt, String systemInstruction, GenerationConfig config) {
        if (!isConfigured()) {
            return Mono.error(new ReasoningBackendUnavailableException(
                "Reasoning backend API key not configured. model=" + model));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(buildRequest(prompt, systemInstruction, config)))
            .flatMap(body -> webClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/v1beta/models/{model}:generateContent")
                    .queryParam("key", "{key}")
                    .build(model, apiKey))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class))
            .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                .filter(GeminiReasoningClient::isTransient)
                .doBeforeRetry(signal -> log.warn("[Reasoning] Transient failure, retrying. model={} attempt={} reason={}",
                    model, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((backoff, signal) -> signal.failure()))
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Reasoning backend returned an empty body")))
            .map(this::extractText);
    }

    private Map<String, Object> buildRequest(String prompt, String systemInstruction, GenerationConfig config) {
        Map<String, Object> request = new HashMap<>();
        request.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemInstruction))));
        request.put("contents", List.of(Map.of(
            "role", "user",
            "parts", List.of(Map.of("text", prompt)))));
        request.put("generationConfig", Map.of(
            "temperature", config.temperature(),
            "maxOutputTokens", config.maxOutputTokens()));
        if (config.searchGrounding()) {
            request.put("tools", List.of(Map.of("google_search", Map.of())));
        }
        return request;
    }

    private String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable reasoning backend response", e);
        }
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            String reason = root.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new IllegalStateException("Reasoning backend returned no text: " + reason);
        }
        return text.asText();
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().value() == HttpStatus.SERVICE_UNAVAILABLE.value()
                || wcre.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return error instanceof WebClientRequestException;
    }
}
