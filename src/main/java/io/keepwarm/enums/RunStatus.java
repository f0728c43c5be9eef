package io.keepwarm.enums;

/**
 * Run status of a scheduled model.
 * 
 * <ul>
 *   <li><strong>IDLE</strong> - Schedule exists but has never been started</li>
 *   <li><strong>RUNNING</strong> - Schedule is enabled and probes are succeeding or failing below the threshold</li>
 *   <li><strong>ERROR</strong> - Consecutive failures reached the threshold, or the credential was rejected</li>
 *   <li><strong>STOPPED</strong> - Schedule was explicitly stopped; history is kept for display</li>
 * </ul>
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    ERROR,
    STOPPED
}
