package com.iimsoft.planner.metrics;

import lombok.Value;

/**
 * Summary of a finished assignment set. Efficiency and utilization are percentages.
 */
@Value
public class DistributionMetrics {

    public static final DistributionMetrics EMPTY = new DistributionMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0, 0.0);

    double efficiency;
    double totalCost;
    double totalSpanHours;
    double resourceUtilization;
    double totalWorkHours;
    int resourcesUsed;
    double averageCostPerHour;
}
