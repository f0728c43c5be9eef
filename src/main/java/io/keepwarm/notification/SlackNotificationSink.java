package io.keepwarm.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.keepwarm.enums.RunStatus;
import io.keepwarm.enums.WindowTransition;
import io.keepwarm.notification.events.ColdStartEvent;
import io.keepwarm.notification.events.EngineEvent;
import io.keepwarm.notification.events.StartProbeEvent;
import io.keepwarm.notification.events.StatusChangeEvent;
import io.keepwarm.notification.events.WindowTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

import static io.keepwarm.config.Constants.CONTENT_TYPE_JSON;
import static io.keepwarm.config.Constants.HEADER_CONTENT_TYPE;

/**
 * Posts engine events to a Slack incoming webhook.
 *
 * Status changes into ERROR carry a mention of the configured user, group or channel
 * keyword. Window transitions, daily cold starts and start probes are posted as plain messages.
 * Tick summaries are not posted.
 */
@Slf4j
public class SlackNotificationSink implements NotificationSink {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss z", Locale.ENGLISH);

    private final String webhookUrl;
    private final String mentionUser;
    private final String username;
    private final String channel;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SlackNotificationSink(String webhookUrl, String mentionUser, String username, String channel,
                                 ObjectMapper objectMapper) {
        this(webhookUrl, mentionUser, username, channel, objectMapper,
            HttpClient.newBuilder().connectTimeout(WEBHOOK_TIMEOUT).build());
    }

    SlackNotificationSink(String webhookUrl, String mentionUser, String username, String channel,
                          ObjectMapper objectMapper, HttpClient httpClient) {
        this.webhookUrl = webhookUrl;
        this.mentionUser = mentionUser;
        this.username = username;
        this.channel = channel;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public void publish(EngineEvent event) throws IOException, InterruptedException {
        Optional<String> text = formatMessage(event);
        if (text.isEmpty()) {
            return;
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", text.get());
        if (username != null && !username.isBlank()) {
            payload.put("username", username);
        }
        if (channel != null && !channel.isBlank()) {
            payload.put("channel", channel);
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(webhookUrl))
            .timeout(WEBHOOK_TIMEOUT)
            .header(HEADER_CONTENT_TYPE, CONTENT_TYPE_JSON)
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("Slack webhook returned HTTP " + response.statusCode() + ": " + response.body());
        }
        log.debug("Slack notification sent for {}", event.getClass().getSimpleName());
    }

    @Override
    public String getName() {
        return "slack";
    }

    Optional<String> formatMessage(EngineEvent event) {
        if (event instanceof StatusChangeEvent) {
            return Optional.of(formatStatusChange((StatusChangeEvent) event));
        }
        if (event instanceof WindowTransitionEvent) {
            return Optional.of(formatWindowTransition((WindowTransitionEvent) event));
        }
        if (event instanceof ColdStartEvent) {
            return Optional.of(formatColdStart((ColdStartEvent) event));
        }
        if (event instanceof StartProbeEvent) {
            return Optional.of(formatStartProbe((StartProbeEvent) event));
        }
        return Optional.empty();
    }

    private String formatStatusChange(StatusChangeEvent event) {
        if (event.isAlert()) {
            return String.format(":rotating_light: %s *[URGENT]* Model `%s` entered ERROR after %d consecutive failure(s) "
                    + "(%s: %s). Please take action before customers hit a cold endpoint.",
                formatMention(mentionUser), event.getModelId(), event.getConsecutiveFailures(),
                event.getFailureKind(), event.getErrorDetail());
        }
        if (event.getOldStatus() == RunStatus.ERROR && event.getNewStatus() == RunStatus.RUNNING) {
            return String.format(":white_check_mark: Model `%s` recovered and is RUNNING again", event.getModelId());
        }
        return String.format(":information_source: Model `%s` status %s -> %s",
            event.getModelId(), event.getOldStatus(), event.getNewStatus());
    }

    private String formatWindowTransition(WindowTransitionEvent event) {
        if (event.getTransition() == WindowTransition.OPENED) {
            return String.format(":sunrise: Keep-warm window opened for `%s` (%s ~ %s %s, every %d min)",
                event.getModelId(), event.getFromTime(), event.getToTime(), event.getTimezone(),
                event.getIntervalMinutes());
        }
        return String.format(":city_sunset: Keep-warm window closed for `%s`, next window starts at %s %s",
            event.getModelId(), event.getFromTime(), event.getTimezone());
    }

    private String formatColdStart(ColdStartEvent event) {
        if (event.getOutcome().isSuccess()) {
            return String.format(":fire: *Cold Start Successful* for `%s` (attempt %d/%d)%n"
                    + "Start: %s, response: %s, latency %dms",
                event.getModelId(), event.getOutcome().getAttempts(), event.getMaxAttempts(),
                formatTime(event.getFiredAt(), event.getTimezone()),
                formatTime(event.getCompletedAt(), event.getTimezone()),
                event.getOutcome().getLatencyMillis());
        }
        return String.format(":snowflake: *Cold Start Failed* for `%s` after %d/%d attempt(s)%n"
                + "Start: %s, last error: %s %s",
            event.getModelId(), event.getOutcome().getAttempts(), event.getMaxAttempts(),
            formatTime(event.getFiredAt(), event.getTimezone()),
            event.getOutcome().getFailureKind(), event.getOutcome().getMessage());
    }

    private static String formatTime(Instant instant, String timezone) {
        if (instant == null) {
            return "n/a";
        }
        ZoneId zone = timezone != null ? ZoneId.of(timezone) : ZoneId.of("UTC");
        return TIME_FORMAT.format(instant.atZone(zone));
    }

    private String formatStartProbe(StartProbeEvent event) {
        if (event.getOutcome().isSuccess()) {
            return String.format(":rocket: Model `%s` started. Initial probe succeeded in %dms, "
                    + "scheduled every %d min (%s ~ %s %s)",
                event.getModelId(), event.getOutcome().getLatencyMillis(), event.getIntervalMinutes(),
                event.getFromTime(), event.getToTime(), event.getTimezone());
        }
        return String.format(":warning: Model `%s` started but the initial probe failed after %d attempt(s): %s %s",
            event.getModelId(), event.getOutcome().getAttempts(), event.getOutcome().getFailureKind(),
            event.getOutcome().getMessage());
    }

    /**
     * Group ids start with S, user ids with U; anything else is a special mention such as "here".
     */
    static String formatMention(String mentionUser) {
        if (mentionUser == null || mentionUser.isBlank()) {
            return "";
        }
        if (mentionUser.startsWith("S")) {
            return "<!subteam^" + mentionUser + ">";
        }
        if (mentionUser.startsWith("U")) {
            return "<@" + mentionUser + ">";
        }
        return "<!" + mentionUser + ">";
    }
}
