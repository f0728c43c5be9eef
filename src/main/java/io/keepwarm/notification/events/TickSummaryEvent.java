package io.keepwarm.notification.events;

import io.keepwarm.models.TickSummary;
import lombok.Value;

import java.time.Instant;

/**
 * Emitted once per tick.
 */
@Value
public class TickSummaryEvent implements EngineEvent {
    TickSummary summary;
    
    @Override
    public Instant getTimestamp() {
        return summary.getTickAt();
    }
    
    @Override
    public String describe() {
        return String.format("Tick at %s: evaluated=%d, due=%d, succeeded=%d, failed=%d, skipped=%d, discarded=%d",
            summary.getTickAt(), summary.getEvaluated(), summary.getDue(), summary.getSucceeded(),
            summary.getFailed(), summary.getSkippedInFlight(), summary.getDiscarded());
    }
}
