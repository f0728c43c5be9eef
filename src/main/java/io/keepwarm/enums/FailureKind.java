package io.keepwarm.enums;

/**
 * Classification of a failed probe attempt.
 */
public enum FailureKind {
    /**
     * No response within the request or probe timeout.
     */
    TIMEOUT(true),
    
    /**
     * 5xx response or connection level error.
     */
    TRANSIENT(true),
    
    /**
     * 429 from the endpoint.
     */
    RATE_LIMITED(true),
    
    /**
     * Endpoint reported that it is still initializing. Expected, soft-counted.
     */
    COLD_START(true),
    
    /**
     * 401 or 403. The credential is wrong, retrying cannot help.
     */
    AUTH_FAILURE(false),
    
    /**
     * Any other 4xx.
     */
    REJECTED(false),
    
    /**
     * Request could not be built: bad URL, missing credential.
     */
    MISCONFIGURED(false);
    
    private final boolean retryable;
    
    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
}
