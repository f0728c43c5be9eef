package io.keepwarm.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted unit of the schedule store: a definition and its last known run state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleRecord {
    
    @JsonProperty("definition")
    private ScheduleDefinition definition;
    
    @JsonProperty("state")
    private RunState state;
    
    public ScheduleRecord copy() {
        return new ScheduleRecord(
            definition != null ? definition.copy() : null,
            state != null ? state.copy() : null
        );
    }
}
