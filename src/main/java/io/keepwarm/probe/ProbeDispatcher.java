package io.keepwarm.probe;

import io.keepwarm.enums.FailureKind;
import io.keepwarm.models.ProbeOutcome;
import io.keepwarm.models.ScheduleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Sends a probe for one model with bounded retries and exponential backoff.
 * 
 * Only retryable failure kinds consume further attempts; AUTH_FAILURE, REJECTED and
 * MISCONFIGURED end the probe at once. Every error is converted into a {@link ProbeOutcome},
 * nothing is thrown to the caller.
 * 
 * Holds no mutable state, so the engine calls it from many threads at once.
 */
@Slf4j
public class ProbeDispatcher {
    
    private final ProbeTransport transport;
    private final OutcomeClassifier classifier;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    
    public ProbeDispatcher(ProbeTransport transport, OutcomeClassifier classifier,
                           BackoffPolicy backoffPolicy, Sleeper sleeper) {
        this.transport = transport;
        this.classifier = classifier;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
    }
    
    public ProbeOutcome send(ScheduleDefinition definition) {
        String modelId = definition.getModelId();
        boolean coldStartSeen = false;
        int attempt = 0;
        FailureKind lastKind;
        String lastMessage;
        
        while (true) {
            attempt++;
            try {
                ProbeResponse response = transport.execute(definition);
                lastKind = classifier.classify(response);
                if (lastKind == null) {
                    log.info("[Model: {}] Probe succeeded on attempt {}/{} in {}ms",
                        modelId, attempt, backoffPolicy.getMaxAttempts(), response.getLatencyMillis());
                    return ProbeOutcome.success(response.getLatencyMillis(), attempt);
                }
                lastMessage = String.format("HTTP %d: %s", response.getStatusCode(), abbreviate(response.getBody()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Model: {}] Probe interrupted on attempt {}", modelId, attempt);
                return ProbeOutcome.failure(FailureKind.TIMEOUT, "Probe interrupted", attempt);
            } catch (Exception e) {
                lastKind = classifier.classify(e, coldStartSeen);
                lastMessage = e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
            }
            
            if (lastKind == FailureKind.COLD_START) {
                coldStartSeen = true;
            }
            log.warn("[Model: {}] Probe attempt {}/{} failed: kind={}, detail={}",
                modelId, attempt, backoffPolicy.getMaxAttempts(), lastKind, lastMessage);
            
            if (!lastKind.isRetryable() || !backoffPolicy.hasAttemptsLeft(attempt)) {
                break;
            }
            
            Duration delay = backoffPolicy.delayAfterAttempt(attempt);
            try {
                log.debug("[Model: {}] Waiting {}ms before attempt {}", modelId, delay.toMillis(), attempt + 1);
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Model: {}] Probe backoff interrupted after attempt {}", modelId, attempt);
                return ProbeOutcome.failure(lastKind, lastMessage, attempt);
            }
        }
        
        log.warn("[Model: {}] Probe failed after {} attempt(s): kind={}", modelId, attempt, lastKind);
        return ProbeOutcome.failure(lastKind, lastMessage, attempt);
    }
    
    public int getMaxAttempts() {
        return backoffPolicy.getMaxAttempts();
    }
    
    private static String abbreviate(String body) {
        if (body == null || body.isEmpty()) {
            return "<empty body>";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
