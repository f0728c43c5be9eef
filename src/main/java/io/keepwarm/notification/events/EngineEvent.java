package io.keepwarm.notification.events;

import java.time.Instant;

/**
 * Event published by the scheduler engine to notification sinks.
 */
public interface EngineEvent {
    
    Instant getTimestamp();
    
    /**
     * One-line human readable description, used by log based sinks.
     */
    String describe();
}
