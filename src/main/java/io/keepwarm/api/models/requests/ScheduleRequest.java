package io.keepwarm.api.models.requests;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.keepwarm.models.ScheduleDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * Request body for PUT /api/v1/schedules/{modelId}. The model id comes from the path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleRequest {
    
    @JsonProperty("target_url")
    private String targetUrl;
    
    @JsonProperty("from_time")
    @JsonFormat(pattern = "HH:mm[:ss]")
    private LocalTime fromTime;
    
    @JsonProperty("to_time")
    @JsonFormat(pattern = "HH:mm[:ss]")
    private LocalTime toTime;
    
    @JsonProperty("wraps_midnight")
    private boolean wrapsMidnight;
    
    @JsonProperty("interval_minutes")
    private int intervalMinutes;
    
    @JsonProperty("timezone")
    private String timezone;
    
    public ScheduleDefinition toDefinition(String modelId) {
        return ScheduleDefinition.builder()
            .modelId(modelId)
            .targetUrl(targetUrl != null ? targetUrl.trim() : null)
            .fromTime(fromTime)
            .toTime(toTime)
            .wrapsMidnight(wrapsMidnight)
            .intervalMinutes(intervalMinutes)
            .timezone(timezone)
            .build();
    }
}
