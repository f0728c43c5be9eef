package io.keepwarm.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.keepwarm.config.Constants.*;

/**
 * Configuration for the keep-warm controller.
 * Loads the {@code keepwarm:} section of application.yml with fallbacks to {@link Constants}.
 * An external file named by {@code KEEPWARM_CONFIG_FILE} takes precedence over the classpath.
 */
@Slf4j
@Getter
public class KeepWarmConfig {

    private final String instanceId;
    private final String storeDirectory;
    private final long tickIntervalSeconds;
    private final boolean tickEnabled;

    private final int failureThreshold;
    private final int maxConcurrentProbes;
    private final long probeTimeoutSeconds;

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final long requestTimeoutSeconds;
    private final long connectTimeoutSeconds;
    private final String apiKeyEnv;
    private final List<String> coldStartMarkers;
    private final String probeMessage;

    private final int maxIntervalMinutes;
    private final String defaultTimezone;

    private final boolean slackEnabled;
    private final String slackWebhookUrlEnv;
    private final String slackMentionUser;
    private final String slackUsername;
    private final String slackChannel;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "KEEPWARM_CONFIG_FILE";

    public KeepWarmConfig() {
        this(loadYamlConfig());
    }

    KeepWarmConfig(ConfigModel config) {
        KeepWarm root = config.getKeepwarm() != null ? config.getKeepwarm() : new KeepWarm();
        Store store = root.getStore() != null ? root.getStore() : new Store();
        Tick tick = root.getTick() != null ? root.getTick() : new Tick();
        Engine engine = root.getEngine() != null ? root.getEngine() : new Engine();
        Dispatch dispatch = root.getDispatch() != null ? root.getDispatch() : new Dispatch();
        Schedule schedule = root.getSchedule() != null ? root.getSchedule() : new Schedule();
        Slack slack = root.getSlack() != null ? root.getSlack() : new Slack();

        this.instanceId = textOr(root.getInstanceId(), DEFAULT_INSTANCE_ID);
        this.storeDirectory = textOr(store.getDirectory(), DEFAULT_STORE_DIRECTORY);
        this.tickIntervalSeconds = positiveOr("tick.intervalSeconds", tick.getIntervalSeconds(), DEFAULT_TICK_INTERVAL_SECONDS);
        this.tickEnabled = tick.getEnabled() == null || tick.getEnabled();

        this.failureThreshold = positiveOr("engine.failureThreshold", engine.getFailureThreshold(), DEFAULT_FAILURE_THRESHOLD);
        this.maxConcurrentProbes = positiveOr("engine.maxConcurrentProbes", engine.getMaxConcurrentProbes(), DEFAULT_MAX_CONCURRENT_PROBES);
        this.probeTimeoutSeconds = positiveOr("engine.probeTimeoutSeconds", engine.getProbeTimeoutSeconds(), DEFAULT_PROBE_TIMEOUT_SECONDS);

        this.maxAttempts = positiveOr("dispatch.maxAttempts", dispatch.getMaxAttempts(), DEFAULT_MAX_ATTEMPTS);
        this.baseDelayMillis = positiveOr("dispatch.baseDelayMillis", dispatch.getBaseDelayMillis(), DEFAULT_BASE_DELAY_MILLIS);
        this.maxDelayMillis = Math.max(baseDelayMillis,
            positiveOr("dispatch.maxDelayMillis", dispatch.getMaxDelayMillis(), DEFAULT_MAX_DELAY_MILLIS));
        this.requestTimeoutSeconds = positiveOr("dispatch.requestTimeoutSeconds", dispatch.getRequestTimeoutSeconds(), DEFAULT_REQUEST_TIMEOUT_SECONDS);
        this.connectTimeoutSeconds = positiveOr("dispatch.connectTimeoutSeconds", dispatch.getConnectTimeoutSeconds(), DEFAULT_CONNECT_TIMEOUT_SECONDS);
        this.apiKeyEnv = textOr(dispatch.getApiKeyEnv(), DEFAULT_API_KEY_ENV);
        this.coldStartMarkers = dispatch.getColdStartMarkers() != null
            ? List.copyOf(dispatch.getColdStartMarkers())
            : List.of(COLD_START_MARKER_IN_QUEUE, COLD_START_MARKER_INITIALIZING, COLD_START_MARKER_COLD_START);
        this.probeMessage = textOr(dispatch.getProbeMessage(), DEFAULT_PROBE_MESSAGE);

        this.maxIntervalMinutes = positiveOr("schedule.maxIntervalMinutes", schedule.getMaxIntervalMinutes(), DEFAULT_MAX_INTERVAL_MINUTES);
        this.defaultTimezone = textOr(schedule.getDefaultTimezone(), DEFAULT_TIMEZONE);

        this.slackEnabled = slack.getEnabled() != null && slack.getEnabled();
        this.slackWebhookUrlEnv = textOr(slack.getWebhookUrlEnv(), DEFAULT_SLACK_WEBHOOK_ENV);
        this.slackMentionUser = textOr(slack.getMentionUser(), DEFAULT_SLACK_MENTION);
        this.slackUsername = textOr(slack.getUsername(), DEFAULT_SLACK_USERNAME);
        this.slackChannel = slack.getChannel();

        log.info("Loaded keep-warm config - instance: {}, store: {}, tick interval: {}s, threshold: {}, max concurrent probes: {}",
                instanceId, storeDirectory, tickIntervalSeconds, failureThreshold, maxConcurrentProbes);
    }

    /**
     * Parses a YAML document into the configuration model. Unknown keys are ignored.
     */
    static ConfigModel parse(InputStream inputStream) {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        ConfigModel config = new Yaml(constructor).load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = KeepWarmConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private static String textOr(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static int positiveOr(String key, Integer value, int defaultValue) {
        return (int) positiveOr(key, value != null ? value.longValue() : null, (long) defaultValue);
    }

    private static long positiveOr(String key, Long value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} for keepwarm.{}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private KeepWarm keepwarm;
    }

    @Data
    public static class KeepWarm {
        private String instanceId;
        private Store store;
        private Tick tick;
        private Engine engine;
        private Dispatch dispatch;
        private Schedule schedule;
        private Slack slack;
    }

    @Data
    public static class Store {
        private String directory;
    }

    @Data
    public static class Tick {
        private Long intervalSeconds;
        private Boolean enabled;
    }

    @Data
    public static class Engine {
        private Integer failureThreshold;
        private Integer maxConcurrentProbes;
        private Long probeTimeoutSeconds;
    }

    @Data
    public static class Dispatch {
        private Integer maxAttempts;
        private Long baseDelayMillis;
        private Long maxDelayMillis;
        private Long requestTimeoutSeconds;
        private Long connectTimeoutSeconds;
        private String apiKeyEnv;
        private List<String> coldStartMarkers;
        private String probeMessage;
    }

    @Data
    public static class Schedule {
        private Integer maxIntervalMinutes;
        private String defaultTimezone;
    }

    @Data
    public static class Slack {
        private Boolean enabled;
        private String webhookUrlEnv;
        private String mentionUser;
        private String username;
        private String channel;
    }
}
