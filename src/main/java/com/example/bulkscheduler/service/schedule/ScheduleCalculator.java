package com.example.bulkscheduler.service.schedule;

import com.example.bulkscheduler.dto.ScheduleFormats;
import com.example.bulkscheduler.exception.InvalidJobDefinitionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Turns a job's local schedule ("HH:MM" + IANA timezone) into concrete instants
 * and cron expressions.
 * <p>
 * Daylight-saving gaps shift the fire time forward, the same way
 * {@link ZonedDateTime#of} resolves a local time that does not exist.
 */
@Component
@RequiredArgsConstructor
public class ScheduleCalculator {

    private static final Pattern SCHEDULE_TIME_PATTERN = Pattern.compile(ScheduleFormats.SCHEDULE_TIME_REGEX);

    private final Clock clock;

    public LocalTime parseScheduleTime(String scheduleTime) {
        if (scheduleTime == null || !SCHEDULE_TIME_PATTERN.matcher(scheduleTime).matches()) {
            throw new InvalidJobDefinitionException("scheduleTime",
                    String.format("'%s' is not a valid HH:MM time", scheduleTime));
        }
        return LocalTime.parse(scheduleTime);
    }

    public ZoneId parseTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidJobDefinitionException("timezone", "Timezone is required");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidJobDefinitionException("timezone", String.format("Unknown timezone '%s'", timezone));
        }
    }

    /**
     * Fail fast on a schedule that could never be armed
     */
    public void validate(String scheduleTime, String timezone) {
        parseScheduleTime(scheduleTime);
        parseTimezone(timezone);
    }

    public Instant nextRunAt(String scheduleTime, String timezone) {
        return nextRunAt(scheduleTime, timezone, clock.instant());
    }

    /**
     * Next occurrence of the local time in the zone, strictly after {@code now}.
     * Today's occurrence if it is still ahead, otherwise tomorrow's.
     */
    public Instant nextRunAt(String scheduleTime, String timezone, Instant now) {
        var time = parseScheduleTime(scheduleTime);
        var zone = parseTimezone(timezone);

        var today = now.atZone(zone).toLocalDate();
        var candidate = ZonedDateTime.of(today, time, zone).toInstant();
        if (candidate.isAfter(now)) {
            return candidate;
        }
        return ZonedDateTime.of(today.plusDays(1), time, zone).toInstant();
    }

    /**
     * Six-field Spring cron firing daily at the schedule time, e.g. "0 30 6 * * *"
     */
    public String cronExpression(String scheduleTime) {
        var time = parseScheduleTime(scheduleTime);
        return String.format("0 %d %d * * *", time.getMinute(), time.getHour());
    }
}
