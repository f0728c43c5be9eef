package io.keepwarm.notification.events;

import io.keepwarm.enums.FailureKind;
import io.keepwarm.enums.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A model moved from one run status to another.
 */
@Value
@Builder
public class StatusChangeEvent implements EngineEvent {
    String modelId;
    String targetUrl;
    RunStatus oldStatus;
    RunStatus newStatus;
    FailureKind failureKind;
    String errorDetail;
    int consecutiveFailures;
    Instant timestamp;
    
    /**
     * Entering ERROR deserves a mention; every other change is informational.
     */
    public boolean isAlert() {
        return newStatus == RunStatus.ERROR;
    }
    
    @Override
    public String describe() {
        String base = String.format("Model '%s' status %s -> %s", modelId, oldStatus, newStatus);
        if (errorDetail == null) {
            return base;
        }
        return String.format("%s (kind=%s, consecutive failures=%d, detail=%s)",
            base, failureKind, consecutiveFailures, errorDetail);
    }
}
