package com.iimsoft.planner.calendar;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Working-hours calendar of a resource: a daily window, the active weekdays and the break
 * hours taken inside the window. For example 08:00-17:00, Mon-Fri, 1h break gives 8 hours a day.
 */
public class WorkSchedule {

    public static final Set<DayOfWeek> WEEKDAYS = Collections.unmodifiableSet(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

    private final LocalTime start;
    private final LocalTime end;
    private final Set<DayOfWeek> workDays;
    private final double breakHours;

    public WorkSchedule(LocalTime start, LocalTime end, Set<DayOfWeek> workDays, double breakHours) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Invalid working hours range: " + start + ".." + end);
        }
        if (breakHours < 0) {
            throw new IllegalArgumentException("breakHours must be >= 0: " + breakHours);
        }
        this.start = start;
        this.end = end;
        this.workDays = workDays == null || workDays.isEmpty()
                ? WEEKDAYS
                : Collections.unmodifiableSet(EnumSet.copyOf(workDays));
        this.breakHours = breakHours;
    }

    /** 默认白班：08:00-17:00，周一至周五，午休 1 小时 */
    public static WorkSchedule defaultOfficeHours() {
        return new WorkSchedule(LocalTime.of(8, 0), LocalTime.of(17, 0), WEEKDAYS, 1.0);
    }

    public LocalTime getStart() { return start; }
    public LocalTime getEnd() { return end; }
    public Set<DayOfWeek> getWorkDays() { return workDays; }
    public double getBreakHours() { return breakHours; }

    public double getHoursPerDay() {
        int minutes = (end.getHour() * 60 + end.getMinute()) - (start.getHour() * 60 + start.getMinute());
        return Math.max(0.0, minutes / 60.0 - breakHours);
    }

    public double getHoursPerWeek() {
        return getHoursPerDay() * workDays.size();
    }

    public boolean isWorkDay(DayOfWeek day) {
        return workDays.contains(day);
    }

    @Override
    public String toString() {
        return "WorkSchedule{" + start + "-" + end + ", days=" + workDays + ", break=" + breakHours + "h}";
    }
}
