package io.keepwarm.notification;

import io.keepwarm.notification.events.EngineEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of engine events to every registered sink.
 * Delivery runs on the given executor; sink errors are logged locally and dropped.
 */
@Slf4j
public class NotificationPublisher {
    
    private final List<NotificationSink> sinks;
    private final Executor deliveryExecutor;
    
    public NotificationPublisher(List<NotificationSink> sinks, Executor deliveryExecutor) {
        this.sinks = List.copyOf(sinks);
        this.deliveryExecutor = deliveryExecutor;
        log.info("NotificationPublisher initialized with sinks: {}", 
            this.sinks.stream().map(NotificationSink::getName).toList());
    }
    
    public void publish(EngineEvent event) {
        for (NotificationSink sink : sinks) {
            try {
                deliveryExecutor.execute(() -> deliver(sink, event));
            } catch (RejectedExecutionException e) {
                log.warn("Notification delivery rejected for sink {}: {}", sink.getName(), event.describe());
            }
        }
    }
    
    private void deliver(NotificationSink sink, EngineEvent event) {
        try {
            sink.publish(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Notification sink {} interrupted while delivering {}", sink.getName(), event.getClass().getSimpleName());
        } catch (Exception e) {
            log.warn("Notification sink {} failed to deliver {}: {}",
                sink.getName(), event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
