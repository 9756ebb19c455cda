package com.swarmverify.resolution.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Keyless client for the DuckDuckGo instant-answer API ({@code /?q=...&format=json}).
 *
 * <p>The endpoint answers with a JavaScript content type, so the body is read as a
 * string and parsed with the shared {@link ObjectMapper}.
 */
public class InstantAnswerClient {

    private static final Logger log = LoggerFactory.getLogger(InstantAnswerClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public InstantAnswerClient(WebClient webClient, ObjectMapper objectMapper, boolean enabled) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.enabled      = enabled;
    }

    public Mono<InstantAnswer> lookup(String query) {
        if (!enabled) {
            return Mono.error(new IllegalStateException("Instant-answer search is disabled"));
        }
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/")
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("no_html", "1")
                .build(query))
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty instant-answer response")))
            .map(this::parse)
            .doOnSuccess(answer -> log.debug("[Search] Instant answer fetched. abstractLength={}",
                answer.abstractText().length()));
    }

    private InstantAnswer parse(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            return new InstantAnswer(root.path("AbstractText").asText(""), root.path("AbstractURL").asText(""));
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable instant-answer response", e);
        }
    }
}
