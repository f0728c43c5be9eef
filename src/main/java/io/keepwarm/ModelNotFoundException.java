package io.keepwarm;

import lombok.Getter;

/**
 * Raised by control operations addressing a model id the engine does not know.
 */
@Getter
public class ModelNotFoundException extends RuntimeException {
    
    private final String modelId;
    
    public ModelNotFoundException(String modelId) {
        super("Model '" + modelId + "' not found");
        this.modelId = modelId;
    }
}
