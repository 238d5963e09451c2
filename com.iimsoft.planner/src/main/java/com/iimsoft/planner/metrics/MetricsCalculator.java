package com.iimsoft.planner.metrics;

import com.iimsoft.planner.domain.Assignment;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 分配结果指标计算
 */
public class MetricsCalculator {

    /**
     * @param totalResources size of the resource list the caller offered, used as the utilization denominator
     */
    public DistributionMetrics distribution(List<Assignment> assignments, int totalResources) {
        if (assignments.isEmpty()) {
            return DistributionMetrics.EMPTY;
        }
        double totalCost = 0.0;
        double workHours = 0.0;
        for (Assignment a : assignments) {
            totalCost += a.getEstimatedCost();
            workHours += a.getHoursAssigned();
        }
        double span = spanHours(assignments);
        int used = resourcesUsed(assignments);

        double efficiency = span > 0 ? Math.min(workHours / span * 100.0, 100.0) : 0.0;
        double utilization = totalResources > 0 ? (double) used / totalResources * 100.0 : 0.0;
        double avgCostPerHour = workHours > 0 ? totalCost / workHours : 0.0;
        return new DistributionMetrics(efficiency, totalCost, span, utilization, workHours, used, avgCostPerHour);
    }

    /**
     * Hours between the earliest start and the latest end; 0 for an empty set.
     */
    public static double spanHours(List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            return 0.0;
        }
        LocalDateTime min = assignments.get(0).getStartTime();
        LocalDateTime max = assignments.get(0).getEndTime();
        for (Assignment a : assignments) {
            if (a.getStartTime().isBefore(min)) min = a.getStartTime();
            if (a.getEndTime().isAfter(max)) max = a.getEndTime();
        }
        return Duration.between(min, max).toSeconds() / 3600.0;
    }

    public static int resourcesUsed(List<Assignment> assignments) {
        return (int) assignments.stream().map(Assignment::getResourceId).distinct().count();
    }
}
