package com.swarmverify.resolution.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Builds {@link InstantAnswerClient}s backed by a canned HTTP response. */
public final class InstantAnswerStubs {

    private InstantAnswerStubs() {}

    public static InstantAnswerClient answering(String abstractText, String abstractUrl) {
        String body = "{\"AbstractText\":\"" + abstractText + "\",\"AbstractURL\":\"" + abstractUrl + "\"}";
        return client(HttpStatus.OK, body, true);
    }

    public static InstantAnswerClient failingWith(HttpStatus status) {
        return client(status, "{}", true);
    }

    /** 200 with no body at all. */
    public static InstantAnswerClient silent() {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://search.test")
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()))
            .build();
        return new InstantAnswerClient(webClient, new ObjectMapper(), true);
    }

    public static InstantAnswerClient disabled() {
        return client(HttpStatus.OK, "{}", false);
    }

    private static InstantAnswerClient client(HttpStatus status, String body, boolean enabled) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://search.test")
            .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/x-javascript")
                .body(body)
                .build()))
            .build();
        return new InstantAnswerClient(webClient, new ObjectMapper(), enabled);
    }
}
