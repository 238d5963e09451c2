package com.iimsoft.planner.capacity;

import lombok.Value;

import java.time.LocalDate;

/**
 * Half-open planning period {@code [start, end)}.
 */
@Value
public class PlanningWindow {
    LocalDate start;
    LocalDate end;

    public static PlanningWindow of(LocalDate start, LocalDate end) {
        return new PlanningWindow(start, end);
    }
}
