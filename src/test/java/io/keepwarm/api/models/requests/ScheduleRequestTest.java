package io.keepwarm.api.models.requests;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.keepwarm.models.ScheduleDefinition;
import io.keepwarm.schedule.InvalidScheduleException;
import io.keepwarm.schedule.ScheduleValidator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void testParsesRequestBody() throws Exception {
        String json = "{"
            + "\"target_url\": \"https://api.example.com/v2/abc/runsync\","
            + "\"from_time\": \"22:00\","
            + "\"to_time\": \"06:00\","
            + "\"wraps_midnight\": true,"
            + "\"interval_minutes\": 30,"
            + "\"timezone\": \"Europe/Berlin\","
            + "\"comment\": \"ignored\""
            + "}";

        ScheduleRequest request = objectMapper.readValue(json, ScheduleRequest.class);
        ScheduleDefinition definition = request.toDefinition("org/model-b");

        assertThat(definition.getModelId()).isEqualTo("org/model-b");
        assertThat(definition.getFromTime()).isEqualTo(LocalTime.of(22, 0));
        assertThat(definition.getToTime()).isEqualTo(LocalTime.of(6, 0));
        assertThat(definition.isWrapsMidnight()).isTrue();
        assertThat(definition.getIntervalMinutes()).isEqualTo(30);
        assertThat(definition.getTimezone()).isEqualTo("Europe/Berlin");
    }

    @Test
    void testMissingTimezoneStaysNull() throws Exception {
        ScheduleRequest request = objectMapper.readValue(
            "{\"target_url\": \"https://x\", \"from_time\": \"07:30\", \"to_time\": \"16:30\", \"interval_minutes\": 60}",
            ScheduleRequest.class);

        assertThat(request.toDefinition("m").getTimezone()).isNull();
        assertThat(request.isWrapsMidnight()).isFalse();
    }

    @Test
    void testAcceptsTimesWithSeconds() throws Exception {
        ScheduleRequest request = objectMapper.readValue(
            "{\"target_url\": \"https://x\", \"from_time\": \"07:30:00\", \"to_time\": \"16:30:00\", "
                + "\"interval_minutes\": 60}",
            ScheduleRequest.class);

        assertThat(request.getFromTime()).isEqualTo(LocalTime.of(7, 30));
        assertThat(request.getToTime()).isEqualTo(LocalTime.of(16, 30));
    }

    @Test
    void testNonZeroSecondsAreLeftToTheValidator() throws Exception {
        ScheduleRequest request = objectMapper.readValue(
            "{\"target_url\": \"https://api.example.com/m\", \"from_time\": \"07:30:15\", "
                + "\"to_time\": \"16:30\", \"interval_minutes\": 60, \"timezone\": \"Asia/Seoul\"}",
            ScheduleRequest.class);
        ScheduleValidator validator = new ScheduleValidator(1440,
            Clock.fixed(Instant.parse("2026-01-10T00:00:00Z"), ZoneOffset.UTC));

        assertThat(request.getFromTime()).isEqualTo(LocalTime.of(7, 30, 15));
        assertThatThrownBy(() -> validator.validate(request.toDefinition("m")))
            .isInstanceOf(InvalidScheduleException.class);
    }
}
