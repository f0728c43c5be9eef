package io.keepwarm.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.keepwarm.enums.FailureKind;
import io.keepwarm.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mutable run state of a model. Only the scheduler engine writes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunState {
    
    @Builder.Default
    @JsonProperty("status")
    private RunStatus status = RunStatus.IDLE;
    
    @JsonProperty("last_fire_at")
    private Instant lastFireAt;
    
    @JsonProperty("last_success_at")
    private Instant lastSuccessAt;
    
    @JsonProperty("consecutive_failures")
    private int consecutiveFailures;
    
    @JsonProperty("last_error_message")
    private String lastErrorMessage;
    
    @JsonProperty("last_failure_kind")
    private FailureKind lastFailureKind;
    
    @JsonProperty("last_latency_millis")
    private Long lastLatencyMillis;
    
    @JsonProperty("window_open")
    private boolean windowOpen;
    
    public static RunState idle() {
        return RunState.builder().build();
    }
    
    public RunState copy() {
        return toBuilder().build();
    }
}
