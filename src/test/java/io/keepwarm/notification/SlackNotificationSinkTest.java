package io.keepwarm.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.keepwarm.enums.FailureKind;
import io.keepwarm.enums.RunStatus;
import io.keepwarm.enums.WindowTransition;
import io.keepwarm.models.ProbeOutcome;
import io.keepwarm.models.TickSummary;
import io.keepwarm.notification.events.ColdStartEvent;
import io.keepwarm.notification.events.StartProbeEvent;
import io.keepwarm.notification.events.StatusChangeEvent;
import io.keepwarm.notification.events.TickSummaryEvent;
import io.keepwarm.notification.events.WindowTransitionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlackNotificationSinkTest {

    private static final Instant NOW = Instant.parse("2026-03-02T01:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> payloads = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private int responseStatus = 200;
    private SlackNotificationSink sink;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hooks/test", exchange -> {
            payloads.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(responseStatus, -1);
            exchange.close();
        });
        server.start();
        String webhookUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/hooks/test";
        sink = new SlackNotificationSink(webhookUrl, "U024BE7LH", "Keep-Warm Supervisor", "#alerts", objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testErrorTransitionPostsMention() throws Exception {
        sink.publish(StatusChangeEvent.builder()
            .modelId("model-a")
            .oldStatus(RunStatus.RUNNING)
            .newStatus(RunStatus.ERROR)
            .failureKind(FailureKind.TRANSIENT)
            .errorDetail("HTTP 500: boom")
            .consecutiveFailures(3)
            .timestamp(NOW)
            .build());

        assertThat(payloads).hasSize(1);
        JsonNode payload = objectMapper.readTree(payloads.get(0));
        assertThat(payload.get("text").asText())
            .contains("<@U024BE7LH>")
            .contains("model-a")
            .contains("HTTP 500: boom");
        assertThat(payload.get("username").asText()).isEqualTo("Keep-Warm Supervisor");
        assertThat(payload.get("channel").asText()).isEqualTo("#alerts");
    }

    @Test
    void testWindowAndStartProbeMessagesArePosted() throws Exception {
        sink.publish(WindowTransitionEvent.builder()
            .modelId("model-a")
            .transition(WindowTransition.OPENED)
            .fromTime(LocalTime.of(7, 30))
            .toTime(LocalTime.of(16, 30))
            .timezone("Asia/Seoul")
            .intervalMinutes(60)
            .timestamp(NOW)
            .build());
        sink.publish(StartProbeEvent.builder()
            .modelId("model-a")
            .outcome(ProbeOutcome.success(850, 1))
            .fromTime(LocalTime.of(7, 30))
            .toTime(LocalTime.of(16, 30))
            .timezone("Asia/Seoul")
            .intervalMinutes(60)
            .timestamp(NOW)
            .build());

        assertThat(payloads).hasSize(2);
        assertThat(objectMapper.readTree(payloads.get(0)).get("text").asText()).contains("window opened");
        assertThat(objectMapper.readTree(payloads.get(1)).get("text").asText()).contains("850ms");
    }

    @Test
    void testColdStartReports() throws Exception {
        sink.publish(ColdStartEvent.builder()
            .modelId("model-a")
            .outcome(ProbeOutcome.success(850, 2).withCompletedAt(NOW.plusSeconds(7)))
            .maxAttempts(3)
            .firedAt(NOW)
            .completedAt(NOW.plusSeconds(7))
            .timezone("Asia/Seoul")
            .timestamp(NOW)
            .build());
        sink.publish(ColdStartEvent.builder()
            .modelId("model-b")
            .outcome(ProbeOutcome.failure(FailureKind.TIMEOUT, "request timed out", 3))
            .maxAttempts(3)
            .firedAt(NOW)
            .timezone("Asia/Seoul")
            .timestamp(NOW)
            .build());

        assertThat(payloads).hasSize(2);
        assertThat(objectMapper.readTree(payloads.get(0)).get("text").asText())
            .contains("Cold Start Successful")
            .contains("model-a")
            .contains("attempt 2/3")
            .contains("10:00:00 KST")
            .contains("10:00:07 KST");
        assertThat(objectMapper.readTree(payloads.get(1)).get("text").asText())
            .contains("Cold Start Failed")
            .contains("3/3")
            .contains("TIMEOUT");
    }

    @Test
    void testTickSummaryIsNotPosted() throws Exception {
        sink.publish(new TickSummaryEvent(TickSummary.builder().tickAt(NOW).build()));

        assertThat(payloads).isEmpty();
    }

    @Test
    void testWebhookErrorIsReported() {
        responseStatus = 404;

        assertThatThrownBy(() -> sink.publish(StatusChangeEvent.builder()
            .modelId("model-a")
            .oldStatus(RunStatus.IDLE)
            .newStatus(RunStatus.RUNNING)
            .timestamp(NOW)
            .build()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("404");
    }

    @Test
    void testMentionFormatting() {
        assertThat(SlackNotificationSink.formatMention("S0123ABC")).isEqualTo("<!subteam^S0123ABC>");
        assertThat(SlackNotificationSink.formatMention("U024BE7LH")).isEqualTo("<@U024BE7LH>");
        assertThat(SlackNotificationSink.formatMention("here")).isEqualTo("<!here>");
        assertThat(SlackNotificationSink.formatMention(null)).isEmpty();
    }
}
