package io.keepwarm.schedule;

import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WindowPolicyTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    private final WindowPolicy windowPolicy = new WindowPolicy();

    @Test
    void testDisabledModelIsNeverDue() {
        ScheduleDefinition definition = dayWindow().toBuilder().enabled(false).build();

        assertThat(windowPolicy.isDue(definition, RunState.idle(), seoul(10, 0))).isFalse();
        assertThat(windowPolicy.isDue(definition, null, seoul(10, 0))).isFalse();
    }

    @Test
    void testFirstFireIsImmediateInsideWindow() {
        assertThat(windowPolicy.isDue(dayWindow(), RunState.idle(), seoul(12, 17))).isTrue();
    }

    @Test
    void testNotDueOutsideWindowEvenWithoutPreviousFire() {
        assertThat(windowPolicy.isDue(dayWindow(), RunState.idle(), seoul(7, 29))).isFalse();
        assertThat(windowPolicy.isDue(dayWindow(), RunState.idle(), seoul(16, 30))).isFalse();
    }

    @Test
    void testIntervalIsMeasuredFromLastFire() {
        RunState state = RunState.builder().lastFireAt(seoul(9, 30)).build();

        assertThat(windowPolicy.isDue(dayWindow(), state, seoul(10, 29))).isFalse();
        assertThat(windowPolicy.isDue(dayWindow(), state, seoul(10, 30))).isTrue();
        assertThat(windowPolicy.isDue(dayWindow(), state, seoul(13, 2))).isTrue();
    }

    @Test
    void testSubMinuteJitterDoesNotDelayNextFire() {
        RunState state = RunState.builder().lastFireAt(seoul(7, 31).plusSeconds(40)).build();

        assertThat(windowPolicy.isDue(dayWindow(), state, seoul(8, 31).plusSeconds(5))).isTrue();
        assertThat(windowPolicy.isDue(dayWindow(), state, seoul(8, 30).plusSeconds(59))).isFalse();
    }

    @Test
    void testWorkingDayScenarioFiresNineTimes() {
        ScheduleDefinition definition = dayWindow();
        RunState state = RunState.idle();
        List<LocalTime> fires = new ArrayList<>();

        // one tick per minute from 07:00 to 17:00 local
        for (Instant now = seoul(7, 0); now.isBefore(seoul(17, 0)); now = now.plusSeconds(60)) {
            if (windowPolicy.isDue(definition, state, now)) {
                fires.add(now.atZone(SEOUL).toLocalTime());
                state.setLastFireAt(now);
            }
        }

        assertThat(fires).containsExactly(
            LocalTime.of(7, 30), LocalTime.of(8, 30), LocalTime.of(9, 30), LocalTime.of(10, 30),
            LocalTime.of(11, 30), LocalTime.of(12, 30), LocalTime.of(13, 30), LocalTime.of(14, 30),
            LocalTime.of(15, 30));
    }

    @Test
    void testMissedBoundariesYieldSingleFire() {
        RunState state = RunState.builder().lastFireAt(seoul(8, 30)).build();
        Instant now = seoul(12, 45);

        assertThat(windowPolicy.isDue(dayWindow(), state, now)).isTrue();
        state.setLastFireAt(now);
        assertThat(windowPolicy.isDue(dayWindow(), state, now)).isFalse();
    }

    @Test
    void testWindowWrappingMidnight() {
        ScheduleDefinition overnight = dayWindow().toBuilder()
            .fromTime(LocalTime.of(22, 0))
            .toTime(LocalTime.of(2, 0))
            .wrapsMidnight(true)
            .build();

        assertThat(windowPolicy.isInWindow(overnight, seoul(22, 0))).isTrue();
        assertThat(windowPolicy.isInWindow(overnight, seoul(23, 59))).isTrue();
        assertThat(windowPolicy.isInWindow(overnight, seoul(0, 0))).isTrue();
        assertThat(windowPolicy.isInWindow(overnight, seoul(1, 59))).isTrue();
        assertThat(windowPolicy.isInWindow(overnight, seoul(2, 0))).isFalse();
        assertThat(windowPolicy.isInWindow(overnight, seoul(21, 59))).isFalse();
    }

    @Test
    void testWindowIsEvaluatedInModelTimezone() {
        ScheduleDefinition utcWindow = dayWindow().toBuilder().timezone("UTC").build();

        // 10:00 in Seoul is 01:00 UTC
        assertThat(windowPolicy.isInWindow(utcWindow, seoul(10, 0))).isFalse();
        assertThat(windowPolicy.isInWindow(dayWindow(), seoul(10, 0))).isTrue();
    }

    @Test
    void testIsIntervalElapsedTruncatesToMinutes() {
        Instant last = Instant.parse("2026-03-02T00:10:59Z");

        assertThat(WindowPolicy.isIntervalElapsed(last, Instant.parse("2026-03-02T00:15:00Z"), 5)).isTrue();
        assertThat(WindowPolicy.isIntervalElapsed(last, Instant.parse("2026-03-02T00:14:59Z"), 5)).isFalse();
    }

    private static ScheduleDefinition dayWindow() {
        return ScheduleDefinition.builder()
            .modelId("org/model-a")
            .targetUrl("https://api.example.com/v2/model-a/openai/v1/chat/completions")
            .fromTime(LocalTime.of(7, 30))
            .toTime(LocalTime.of(16, 30))
            .intervalMinutes(60)
            .timezone("Asia/Seoul")
            .enabled(true)
            .build();
    }

    private static Instant seoul(int hour, int minute) {
        return ZonedDateTime.of(DAY, LocalTime.of(hour, minute), SEOUL).toInstant();
    }
}
