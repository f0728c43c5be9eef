package io.keepwarm.notification;

import io.keepwarm.notification.events.EngineEvent;

/**
 * Receives engine events. Implementations may throw; failures are contained by
 * {@link NotificationPublisher} and never reach the engine.
 */
public interface NotificationSink {
    
    void publish(EngineEvent event) throws Exception;
    
    String getName();
}
