package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Resource;

import java.time.LocalDateTime;

/**
 * 时间轴：根据资源已占用工时推算一次分配的开始和结束时间
 */
public interface AssignmentTimeline {

    /**
     * Day-granular placement: work already queued on the resource pushes the start by whole days,
     * and the interval gets one extra day of slack.
     */
    AssignmentTimeline DAYS = new AssignmentTimeline() {
        @Override
        public LocalDateTime start(LocalDateTime base, Resource resource, double occupiedHours) {
            return base.plusDays((long) Math.floor(occupiedHours / resource.getHoursPerDay()));
        }

        @Override
        public LocalDateTime end(LocalDateTime start, Resource resource, double hours) {
            return start.plusDays((long) Math.ceil(hours / resource.getHoursPerDay()) + 1);
        }
    };

    /**
     * Hour-granular placement: work is queued back to back on the resource.
     */
    AssignmentTimeline HOURS = new AssignmentTimeline() {
        @Override
        public LocalDateTime start(LocalDateTime base, Resource resource, double occupiedHours) {
            return base.plusSeconds(Math.round(occupiedHours * 3600.0));
        }

        @Override
        public LocalDateTime end(LocalDateTime start, Resource resource, double hours) {
            return start.plusSeconds(Math.round(hours * 3600.0));
        }
    };

    LocalDateTime start(LocalDateTime base, Resource resource, double occupiedHours);

    LocalDateTime end(LocalDateTime start, Resource resource, double hours);
}
