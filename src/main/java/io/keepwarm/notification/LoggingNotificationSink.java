package io.keepwarm.notification;

import io.keepwarm.notification.events.ColdStartEvent;
import io.keepwarm.notification.events.EngineEvent;
import io.keepwarm.notification.events.StatusChangeEvent;
import io.keepwarm.notification.events.TickSummaryEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every engine event to the application log.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {
    
    @Override
    public void publish(EngineEvent event) {
        if (event instanceof StatusChangeEvent && ((StatusChangeEvent) event).isAlert()) {
            log.warn("ALERT: {}", event.describe());
        } else if (event instanceof ColdStartEvent && !((ColdStartEvent) event).getOutcome().isSuccess()) {
            log.warn(event.describe());
        } else if (event instanceof TickSummaryEvent) {
            log.debug(event.describe());
        } else {
            log.info(event.describe());
        }
    }
    
    @Override
    public String getName() {
        return "log";
    }
}
