package io.keepwarm.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Counters of a single tick.
 */
@Value
@Builder
public class TickSummary {
    
    @JsonProperty("tick_at")
    Instant tickAt;
    
    // enabled models looked at
    @JsonProperty("evaluated")
    int evaluated;
    
    @JsonProperty("due")
    int due;
    
    @JsonProperty("succeeded")
    int succeeded;
    
    @JsonProperty("failed")
    int failed;
    
    // due by window and interval, but a previous probe was still in flight
    @JsonProperty("skipped_in_flight")
    int skippedInFlight;
    
    // results dropped because the model was stopped, restarted or removed meanwhile
    @JsonProperty("discarded")
    int discarded;
}
