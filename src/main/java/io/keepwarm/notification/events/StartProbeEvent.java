package io.keepwarm.notification.events;

import io.keepwarm.models.ProbeOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Result of the immediate validation probe performed by START.
 */
@Value
@Builder
public class StartProbeEvent implements EngineEvent {
    String modelId;
    String targetUrl;
    ProbeOutcome outcome;
    LocalTime fromTime;
    LocalTime toTime;
    String timezone;
    int intervalMinutes;
    Instant timestamp;
    
    @Override
    public String describe() {
        if (outcome.isSuccess()) {
            return String.format("Model '%s' start probe succeeded in %dms, scheduled every %d min (%s ~ %s %s)",
                modelId, outcome.getLatencyMillis(), intervalMinutes, fromTime, toTime, timezone);
        }
        return String.format("Model '%s' start probe failed after %d attempt(s): %s %s",
            modelId, outcome.getAttempts(), outcome.getFailureKind(), outcome.getMessage());
    }
}
