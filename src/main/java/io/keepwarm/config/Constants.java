package io.keepwarm.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_INSTANCE_ID = "keepwarm-local";
    public static final String DEFAULT_STORE_DIRECTORY = "config/schedules";
    public static final long DEFAULT_TICK_INTERVAL_SECONDS = 60L;
    public static final String DEFAULT_TIMEZONE = "Asia/Seoul";
    public static final int DEFAULT_MAX_INTERVAL_MINUTES = 1440;
    
    // Engine defaults
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_MAX_CONCURRENT_PROBES = 10;
    public static final long DEFAULT_PROBE_TIMEOUT_SECONDS = 120L;
    
    // Dispatch defaults
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MILLIS = 2_000L;
    public static final long DEFAULT_MAX_DELAY_MILLIS = 30_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 60L;
    public static final long DEFAULT_CONNECT_TIMEOUT_SECONDS = 10L;
    public static final String DEFAULT_API_KEY_ENV = "RUNPOD_API_KEY";
    public static final String DEFAULT_PROBE_MESSAGE = "Scheduled keep-warm probe";
    public static final double PROBE_TEMPERATURE = 0.9;
    
    // Markers in a response body that mean the endpoint is still initializing
    public static final String COLD_START_MARKER_IN_QUEUE = "IN_QUEUE";
    public static final String COLD_START_MARKER_INITIALIZING = "initializing";
    public static final String COLD_START_MARKER_COLD_START = "cold start";
    // job states of a 2xx response that was queued instead of served
    public static final String JOB_STATUS_IN_QUEUE = "IN_QUEUE";
    public static final String JOB_STATUS_IN_PROGRESS = "IN_PROGRESS";
    
    // Notification defaults
    public static final String DEFAULT_SLACK_WEBHOOK_ENV = "SLACK_WEBHOOK_URL";
    public static final String DEFAULT_SLACK_USERNAME = "Keep-Warm Supervisor";
    public static final String DEFAULT_SLACK_MENTION = "here";
    
    // HTTP headers
    public static final String HEADER_AUTHORIZATION = "Authorization";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String BEARER_PREFIX = "Bearer ";
    public static final String CONTENT_TYPE_JSON = "application/json";
    
    // Store layout
    public static final String RECORD_FILE_SUFFIX = ".json";
    public static final String TEMP_FILE_SUFFIX = ".tmp";
}
