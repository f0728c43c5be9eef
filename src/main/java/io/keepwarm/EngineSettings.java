package io.keepwarm;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of {@link SchedulerEngine}.
 */
@Value
@Builder
public class EngineSettings {
    int failureThreshold;
    int maxConcurrentProbes;
    Duration probeTimeout;
    String defaultTimezone;
}
