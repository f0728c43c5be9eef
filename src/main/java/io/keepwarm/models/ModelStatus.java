package io.keepwarm.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Point-in-time view of one model for the status table.
 */
@Value
public class ModelStatus {
    
    @JsonProperty("model_id")
    String modelId;
    
    @JsonProperty("definition")
    ScheduleDefinition definition;
    
    @JsonProperty("state")
    RunState state;
}
