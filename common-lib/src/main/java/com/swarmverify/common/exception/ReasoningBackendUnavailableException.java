package com.swarmverify.common.exception;

/**
 * The reasoning backend is missing or unconfigured. The only failure that aborts a
 * resolution call; every other failure is folded into a lower confidence.
 */
public class ReasoningBackendUnavailableException extends RuntimeException {

    public ReasoningBackendUnavailableException(String message) {
        super(message);
    }
}
