package com.example.bulkscheduler.dto;

/**
 * Shared format constants for schedule fields
 */
public final class ScheduleFormats {

    /**
     * 24h local time of day, e.g. 06:30
     */
    public static final String SCHEDULE_TIME_REGEX = "^([01]\\d|2[0-3]):[0-5]\\d$";

    private ScheduleFormats() {
    }
}
