package io.keepwarm.notification.events;

import io.keepwarm.enums.WindowTransition;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalTime;

/**
 * The daily active window of a model opened or closed since the previous tick.
 */
@Value
@Builder
public class WindowTransitionEvent implements EngineEvent {
    String modelId;
    String targetUrl;
    WindowTransition transition;
    LocalTime fromTime;
    LocalTime toTime;
    String timezone;
    int intervalMinutes;
    Instant timestamp;
    
    @Override
    public String describe() {
        return String.format("Model '%s' window %s (%s ~ %s %s, every %d min)",
            modelId, transition == WindowTransition.OPENED ? "opened" : "closed",
            fromTime, toTime, timezone, intervalMinutes);
    }
}
