package io.keepwarm.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Schedule of a single model: where to probe, during which daily window and how often.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleDefinition {
    
    @JsonProperty("model_id")
    private String modelId;
    
    @JsonProperty("target_url")
    private String targetUrl;
    
    @JsonProperty("from_time")
    private LocalTime fromTime;
    
    @JsonProperty("to_time")
    private LocalTime toTime;
    
    @JsonProperty("wraps_midnight")
    private boolean wrapsMidnight;
    
    @JsonProperty("interval_minutes")
    private int intervalMinutes;
    
    @JsonProperty("timezone")
    private String timezone;
    
    @JsonProperty("enabled")
    private boolean enabled;
    
    @JsonProperty("updated_at")
    private Instant updatedAt;
    
    /**
     * Detached copy, safe to hand to a probe task while the engine keeps mutating its own.
     */
    public ScheduleDefinition copy() {
        return toBuilder().build();
    }
}
