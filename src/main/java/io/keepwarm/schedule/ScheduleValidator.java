package io.keepwarm.schedule;

import io.keepwarm.models.ScheduleDefinition;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;

/**
 * Validates schedule definitions before they are accepted by the engine.
 * 
 * Rejected:
 * - blank model id or target URL, non http(s) URL
 * - missing window bounds, equal bounds, to-before-from without the wrap flag,
 *   wrap flag on a window that does not actually wrap
 * - interval outside 1..maxIntervalMinutes
 * - unknown timezone, or a window bound that falls into a DST gap or overlap
 *   of the timezone during the next year (ambiguous local time)
 */
@Slf4j
public class ScheduleValidator {
    
    private static final long DST_LOOKAHEAD_DAYS = 366;
    
    private final int maxIntervalMinutes;
    private final Clock clock;
    
    public ScheduleValidator(int maxIntervalMinutes, Clock clock) {
        this.maxIntervalMinutes = maxIntervalMinutes;
        this.clock = clock;
    }
    
    public void validate(ScheduleDefinition definition) {
        if (definition == null) {
            throw new InvalidScheduleException(null, "definition is required");
        }
        String modelId = definition.getModelId();
        if (modelId == null || modelId.isBlank()) {
            throw new InvalidScheduleException(null, "model_id is required");
        }
        
        validateTargetUrl(modelId, definition.getTargetUrl());
        validateInterval(modelId, definition.getIntervalMinutes());
        ZoneId zone = validateTimezone(modelId, definition.getTimezone());
        validateWindow(modelId, definition.getFromTime(), definition.getToTime(), definition.isWrapsMidnight());
        validateDstBoundaries(modelId, zone, definition.getFromTime(), definition.getToTime());
        
        log.debug("Schedule for model '{}' passed validation", modelId);
    }
    
    private void validateTargetUrl(String modelId, String targetUrl) {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new InvalidScheduleException(modelId, "target_url is required");
        }
        try {
            URI uri = new URI(targetUrl.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new InvalidScheduleException(modelId, "target_url must be an http or https URL: " + targetUrl);
            }
            if (uri.getHost() == null) {
                throw new InvalidScheduleException(modelId, "target_url has no host: " + targetUrl);
            }
        } catch (URISyntaxException e) {
            throw new InvalidScheduleException(modelId, "target_url is not a valid URI: " + e.getMessage());
        }
    }
    
    private void validateInterval(String modelId, int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new InvalidScheduleException(modelId, "interval_minutes must be > 0");
        }
        if (intervalMinutes > maxIntervalMinutes) {
            throw new InvalidScheduleException(modelId,
                String.format("interval_minutes must be <= %d, got %d", maxIntervalMinutes, intervalMinutes));
        }
    }
    
    private ZoneId validateTimezone(String modelId, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleException(modelId, "timezone is required");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException(modelId, "unknown timezone: " + timezone);
        }
    }
    
    private void validateWindow(String modelId, LocalTime from, LocalTime to, boolean wrapsMidnight) {
        if (from == null || to == null) {
            throw new InvalidScheduleException(modelId, "from_time and to_time are required");
        }
        if (from.getSecond() != 0 || from.getNano() != 0 || to.getSecond() != 0 || to.getNano() != 0) {
            throw new InvalidScheduleException(modelId, "from_time and to_time must be whole minutes (HH:mm)");
        }
        if (from.equals(to)) {
            throw new InvalidScheduleException(modelId, "from_time and to_time must differ");
        }
        if (to.isBefore(from) && !wrapsMidnight) {
            throw new InvalidScheduleException(modelId,
                String.format("to_time %s is before from_time %s; set wraps_midnight for an overnight window", to, from));
        }
        if (from.isBefore(to) && wrapsMidnight) {
            throw new InvalidScheduleException(modelId,
                String.format("wraps_midnight is set but window %s-%s does not cross midnight", from, to));
        }
    }
    
    private void validateDstBoundaries(String modelId, ZoneId zone, LocalTime from, LocalTime to) {
        ZoneRules rules = zone.getRules();
        if (rules.isFixedOffset()) {
            return;
        }
        Instant cursor = clock.instant();
        Instant horizon = cursor.plus(DST_LOOKAHEAD_DAYS, ChronoUnit.DAYS);
        ZoneOffsetTransition transition = rules.nextTransition(cursor);
        while (transition != null && transition.getInstant().isBefore(horizon)) {
            if (isAffected(transition, from) || isAffected(transition, to)) {
                throw new InvalidScheduleException(modelId, String.format(
                    "window bound is ambiguous in %s: local times %s-%s are skipped or repeated on %s",
                    zone, transition.getDateTimeBefore().toLocalTime(), transition.getDateTimeAfter().toLocalTime(),
                    transition.getDateTimeBefore().toLocalDate()));
            }
            transition = rules.nextTransition(transition.getInstant());
        }
    }
    
    /**
     * Gap: local times in [before, after) do not exist. Overlap: local times in [after, before) occur twice.
     */
    private static boolean isAffected(ZoneOffsetTransition transition, LocalTime bound) {
        LocalTime before = transition.getDateTimeBefore().toLocalTime();
        LocalTime after = transition.getDateTimeAfter().toLocalTime();
        LocalTime start = transition.isGap() ? before : after;
        LocalTime end = transition.isGap() ? after : before;
        if (start.isBefore(end)) {
            return !bound.isBefore(start) && bound.isBefore(end);
        }
        // transition range crosses midnight
        return !bound.isBefore(start) || bound.isBefore(end);
    }
}
