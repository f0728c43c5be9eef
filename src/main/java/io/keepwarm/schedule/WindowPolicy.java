package io.keepwarm.schedule;

import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Decides whether a model is due for a probe at a given instant.
 * 
 * A model is due when it is enabled, the local time-of-day in its timezone lies inside
 * the half-open window [fromTime, toTime), and either it has never fired or at least
 * intervalMinutes whole minutes passed since the last actual fire.
 * 
 * Stateless and side-effect free.
 */
public class WindowPolicy {
    
    public boolean isDue(ScheduleDefinition definition, RunState state, Instant now) {
        if (!definition.isEnabled()) {
            return false;
        }
        if (!isInWindow(definition, now)) {
            return false;
        }
        if (state == null || state.getLastFireAt() == null) {
            return true;
        }
        return isIntervalElapsed(state.getLastFireAt(), now, definition.getIntervalMinutes());
    }
    
    /**
     * Whether the local time-of-day of {@code now} falls inside the daily window.
     * Ignores the enabled flag.
     */
    public boolean isInWindow(ScheduleDefinition definition, Instant now) {
        LocalTime local = now.atZone(ZoneId.of(definition.getTimezone())).toLocalTime();
        return isInWindow(definition.getFromTime(), definition.getToTime(), definition.isWrapsMidnight(), local);
    }
    
    static boolean isInWindow(LocalTime from, LocalTime to, boolean wrapsMidnight, LocalTime local) {
        if (wrapsMidnight) {
            return !local.isBefore(from) || local.isBefore(to);
        }
        return !local.isBefore(from) && local.isBefore(to);
    }
    
    /**
     * Minute granularity on both ends, so a fire at 07:31:40 is due again at 08:31:05
     * with a 60 minute interval. Boundaries are measured from the last actual fire.
     */
    static boolean isIntervalElapsed(Instant lastFireAt, Instant now, int intervalMinutes) {
        Duration elapsed = Duration.between(
            lastFireAt.truncatedTo(ChronoUnit.MINUTES),
            now.truncatedTo(ChronoUnit.MINUTES)
        );
        return elapsed.toMinutes() >= intervalMinutes;
    }
}
