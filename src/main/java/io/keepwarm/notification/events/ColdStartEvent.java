package io.keepwarm.notification.events;

import io.keepwarm.models.ProbeOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of the first probe after a model's daily window opened.
 */
@Value
@Builder
public class ColdStartEvent implements EngineEvent {
    String modelId;
    String targetUrl;
    ProbeOutcome outcome;
    int maxAttempts;
    Instant firedAt;
    Instant completedAt;
    String timezone;
    Instant timestamp;
    
    @Override
    public String describe() {
        if (outcome.isSuccess()) {
            return String.format("Model '%s' cold start succeeded on attempt %d/%d in %dms",
                modelId, outcome.getAttempts(), maxAttempts, outcome.getLatencyMillis());
        }
        return String.format("Model '%s' cold start failed after %d/%d attempt(s): %s %s",
            modelId, outcome.getAttempts(), maxAttempts, outcome.getFailureKind(), outcome.getMessage());
    }
}
