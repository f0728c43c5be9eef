package io.keepwarm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.keepwarm.config.KeepWarmConfig;
import io.keepwarm.metrics.MetricsProvider;
import io.keepwarm.notification.LoggingNotificationSink;
import io.keepwarm.notification.NotificationPublisher;
import io.keepwarm.notification.NotificationSink;
import io.keepwarm.notification.SlackNotificationSink;
import io.keepwarm.probe.BackoffPolicy;
import io.keepwarm.probe.HttpProbeTransport;
import io.keepwarm.probe.OutcomeClassifier;
import io.keepwarm.probe.ProbeDispatcher;
import io.keepwarm.probe.Sleeper;
import io.keepwarm.schedule.ScheduleValidator;
import io.keepwarm.schedule.WindowPolicy;
import io.keepwarm.store.JsonFileScheduleStore;
import io.keepwarm.store.ScheduleStore;
import io.keepwarm.store.StoreException;
import io.keepwarm.trigger.TickScheduler;
import io.keepwarm.util.EnvironmentUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.tomcat.util.buf.EncodedSolidusHandling;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main Spring Boot application class for the keep-warm controller.
 *
 * Wires the scheduler engine with its file store, HTTP probe dispatcher and notification sinks,
 * starts the periodic tick and exposes the schedule REST API.
 */
@Slf4j
@SpringBootApplication
public class KeepWarmApplication {

    public static void main(String[] args) {
        log.info("Starting Keep-Warm Controller Application");

        try {
            SpringApplication.run(KeepWarmApplication.class, args);
            log.info("Keep-Warm Controller started successfully");
        } catch (Exception e) {
            log.error("Failed to start Keep-Warm Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public KeepWarmConfig config() {
        KeepWarmConfig config = new KeepWarmConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }

    /**
     * Model ids such as {@code org/model-name} are sent as {@code org%2Fmodel-name} in REST paths.
     */
    @Bean
    public WebServerFactoryCustomizer<TomcatServletWebServerFactory> encodedSlashCustomizer() {
        return factory -> factory.addConnectorCustomizers(connector ->
            connector.setEncodedSolidusHandling(EncodedSolidusHandling.PASS_THROUGH.getValue()));
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry registry, KeepWarmConfig config) {
        return new MetricsProvider(registry, config.getInstanceId());
    }

    @Bean
    public ScheduleStore scheduleStore(KeepWarmConfig config, ObjectMapper objectMapper) {
        log.info("Initializing JSON file schedule store");
        return new JsonFileScheduleStore(Paths.get(config.getStoreDirectory()), objectMapper);
    }

    @Bean
    public ProbeDispatcher probeDispatcher(KeepWarmConfig config, ObjectMapper objectMapper) {
        log.info("Initializing ProbeDispatcher with {} attempt(s), backoff {}ms..{}ms",
            config.getMaxAttempts(), config.getBaseDelayMillis(), config.getMaxDelayMillis());
        String apiKeyEnv = config.getApiKeyEnv();
        HttpProbeTransport transport = new HttpProbeTransport(
            Duration.ofSeconds(config.getConnectTimeoutSeconds()),
            Duration.ofSeconds(config.getRequestTimeoutSeconds()),
            () -> EnvironmentUtils.getRequiredEnv(apiKeyEnv),
            objectMapper,
            config.getProbeMessage());
        BackoffPolicy backoffPolicy = new BackoffPolicy(config.getMaxAttempts(),
            Duration.ofMillis(config.getBaseDelayMillis()), Duration.ofMillis(config.getMaxDelayMillis()));
        return new ProbeDispatcher(transport, new OutcomeClassifier(config.getColdStartMarkers(), objectMapper),
            backoffPolicy, Sleeper.SYSTEM);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("keepwarm-notify-%d").setDaemon(true).build());
    }

    @Bean
    public NotificationPublisher notificationPublisher(KeepWarmConfig config, ObjectMapper objectMapper,
                                                       ExecutorService notificationExecutor) {
        List<NotificationSink> sinks = new ArrayList<>();
        sinks.add(new LoggingNotificationSink());
        if (config.isSlackEnabled()) {
            String webhookUrl = EnvironmentUtils.getEnv(config.getSlackWebhookUrlEnv(), null);
            if (webhookUrl == null) {
                log.warn("Slack notifications enabled but {} is not set, Slack sink disabled",
                    config.getSlackWebhookUrlEnv());
            } else {
                sinks.add(new SlackNotificationSink(webhookUrl, config.getSlackMentionUser(),
                    config.getSlackUsername(), config.getSlackChannel(), objectMapper));
            }
        }
        return new NotificationPublisher(sinks, notificationExecutor);
    }

    @Bean
    public SchedulerEngine schedulerEngine(KeepWarmConfig config, ScheduleStore scheduleStore,
                                           ProbeDispatcher probeDispatcher, NotificationPublisher notificationPublisher,
                                           MetricsProvider metricsProvider, Clock clock) {
        log.info("Initializing SchedulerEngine");
        EngineSettings settings = EngineSettings.builder()
            .failureThreshold(config.getFailureThreshold())
            .maxConcurrentProbes(config.getMaxConcurrentProbes())
            .probeTimeout(Duration.ofSeconds(config.getProbeTimeoutSeconds()))
            .defaultTimezone(config.getDefaultTimezone())
            .build();
        SchedulerEngine engine = new SchedulerEngine(scheduleStore, probeDispatcher, notificationPublisher,
            new WindowPolicy(), new ScheduleValidator(config.getMaxIntervalMinutes(), clock),
            metricsProvider, settings, clock);
        try {
            engine.initialize();
        } catch (StoreException e) {
            log.error("Failed to load schedules: {}", e.getMessage(), e);
            engine.close();
            throw new RuntimeException("SchedulerEngine initialization failed", e);
        }
        return engine;
    }

    @Bean(destroyMethod = "stop")
    public TickScheduler tickScheduler(SchedulerEngine schedulerEngine, KeepWarmConfig config) {
        TickScheduler tickScheduler = new TickScheduler(schedulerEngine, config.getTickIntervalSeconds());
        if (config.isTickEnabled()) {
            tickScheduler.start();
            log.info("TickScheduler started with {}s interval", config.getTickIntervalSeconds());
        } else {
            log.info("Periodic tick disabled, ticks only run on demand via POST /api/v1/schedules/_tick");
        }
        return tickScheduler;
    }
}
