package io.keepwarm.metrics;

/**
 * Constants for metrics names and tags used by the keep-warm engine.
 */
public class MetricsConstants {
    public final static String PROBE_TOTAL_METRIC_NAME = "keepwarm_probe_total";
    public final static String PROBE_LATENCY_METRIC_NAME = "keepwarm_probe_latency";
    public final static String MODELS_IN_ERROR_METRIC_NAME = "keepwarm_models_in_error";
    public final static String TICK_TOTAL_METRIC_NAME = "keepwarm_tick_total";
    public final static String INSTANCE_TAG = "instance";
    public final static String MODEL_ID_TAG = "modelId";
    public final static String OUTCOME_TAG = "outcome";

    private MetricsConstants() {}
}
