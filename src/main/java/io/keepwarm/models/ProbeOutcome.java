package io.keepwarm.models;

import io.keepwarm.enums.FailureKind;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Locale;

/**
 * Result of one probe dispatch, after retries.
 * Either a success carrying the latency of the successful attempt,
 * or a failure carrying the kind and detail of the last attempt.
 * {@code completedAt} is stamped by the engine when the probe task returns; it stays null
 * for outcomes the engine synthesized itself (timeout, rejection).
 */
@Value
public class ProbeOutcome {
    
    boolean success;
    Long latencyMillis;
    FailureKind failureKind;
    String message;
    int attempts;
    @With
    Instant completedAt;
    
    public static ProbeOutcome success(long latencyMillis, int attempts) {
        return new ProbeOutcome(true, latencyMillis, null, null, attempts, null);
    }
    
    public static ProbeOutcome failure(FailureKind kind, String message, int attempts) {
        return new ProbeOutcome(false, null, kind, message, attempts, null);
    }
    
    public boolean isFailure(FailureKind kind) {
        return !success && failureKind == kind;
    }
    
    /**
     * Short label used in logs and metric tags.
     */
    public String label() {
        return success ? "success" : failureKind.name().toLowerCase(Locale.ROOT);
    }
}
