package com.iimsoft.planner.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Weekday arithmetic over half-open date ranges. Saturdays and Sundays never count,
 * whatever the resources' own calendars say.
 */
public final class WorkingDays {

    private WorkingDays() {
    }

    /**
     * Number of Monday-Friday days in {@code [start, end)}.
     */
    public static int between(LocalDate start, LocalDate end) {
        if (start == null || end == null || !start.isBefore(end)) {
            return 0;
        }
        int days = 0;
        for (LocalDate d = start; d.isBefore(end); d = d.plusDays(1)) {
            if (isWeekday(d.getDayOfWeek())) {
                days++;
            }
        }
        return days;
    }

    public static boolean isWeekday(DayOfWeek day) {
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }
}
