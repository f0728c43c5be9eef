package io.keepwarm.schedule;

/**
 * A schedule definition was rejected at the control boundary and never reached the store.
 */
public class InvalidScheduleException extends IllegalArgumentException {
    
    private final String modelId;
    
    public InvalidScheduleException(String modelId, String message) {
        super(modelId != null ? "Invalid schedule for model '" + modelId + "': " + message : "Invalid schedule: " + message);
        this.modelId = modelId;
    }
    
    public String getModelId() {
        return modelId;
    }
}
