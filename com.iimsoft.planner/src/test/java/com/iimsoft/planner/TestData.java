package com.iimsoft.planner;

import com.iimsoft.planner.domain.Priority;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.domain.ResourceType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Shared fixtures. The fixed clock sits on Monday 2026-01-05 08:00 UTC.
 */
public final class TestData {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-05T08:00:00Z"), ZoneOffset.UTC);
    public static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private TestData() {
    }

    public static Resource resource(String id, double maxCapacity, double costPerHour, String... capabilities) {
        return resource(id, maxCapacity, 0.0, costPerHour, capabilities);
    }

    public static Resource resource(String id, double maxCapacity, double currentCapacity, double costPerHour, String... capabilities) {
        Resource r = new Resource(id, "Resource " + id, ResourceType.MATERIAL, maxCapacity, currentCapacity, costPerHour);
        for (String c : capabilities) {
            r.addCapability(c);
        }
        return r;
    }

    public static Process process(String id, double hours, String... capabilities) {
        return process(id, hours, Priority.MEDIUM, capabilities);
    }

    public static Process process(String id, double hours, Priority priority, String... capabilities) {
        Process p = new Process(id, "Process " + id, hours, NOW.minusDays(1));
        p.setPriority(priority);
        for (String c : capabilities) {
            p.addRequiredCapability(c);
        }
        return p;
    }
}
