package com.swarmverify.resolution.ai;

import reactor.core.publisher.Mono;

/**
 * Text-completion capability the engine depends on: a system instruction, a user prompt,
 * sampling parameters in; free-form text out. Vendor and authentication stay behind this seam.
 */
public interface ReasoningClient {

    /**
     * @return the completion text; errors if the backend rejects the call or returns no text
     */
    Mono<String> generate(String prompt, String systemInstruction, GenerationConfig config);

    /** {@code false} when credentials or endpoint are missing and no call can succeed. */
    boolean isConfigured();
}
