package com.swarmverify.resolution.guard;

public class RateLimitExceededException extends RuntimeException {

    private final String clientKey;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String clientKey, long retryAfterSeconds) {
        super("Rate limit exceeded for client=" + clientKey + ", retry in " + retryAfterSeconds + "s");
        this.clientKey = clientKey;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getClientKey() { return clientKey; }
    public long getRetryAfterSeconds() { return retryAfterSeconds; }
}
