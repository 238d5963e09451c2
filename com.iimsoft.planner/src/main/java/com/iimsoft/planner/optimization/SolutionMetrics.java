package com.iimsoft.planner.optimization;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.metrics.MetricsCalculator;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class SolutionMetrics {

    public static final SolutionMetrics EMPTY = new SolutionMetrics(0.0, 0.0, 0, 0.0, 0);

    double totalCost;
    double makespanHours;
    int assignmentCount;
    double averageCost;
    int resourcesUsed;

    public static SolutionMetrics of(List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            return EMPTY;
        }
        double cost = assignments.stream().mapToDouble(Assignment::getEstimatedCost).sum();
        return new SolutionMetrics(cost, MetricsCalculator.spanHours(assignments), assignments.size(),
                cost / assignments.size(), MetricsCalculator.resourcesUsed(assignments));
    }

    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("totalCost", totalCost);
        m.put("makespanHours", makespanHours);
        m.put("assignmentCount", assignmentCount);
        m.put("averageCost", averageCost);
        m.put("resourcesUsed", resourcesUsed);
        return m;
    }
}
