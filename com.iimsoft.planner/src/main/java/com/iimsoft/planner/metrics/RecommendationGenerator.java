package com.iimsoft.planner.metrics;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 根据阈值生成文字建议，阈值来自 {@link PlannerSettings.Recommendations}
 */
public class RecommendationGenerator {

    private final PlannerSettings.Recommendations thresholds;

    public RecommendationGenerator(PlannerSettings.Recommendations thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public RecommendationGenerator() {
        this(new PlannerSettings.Recommendations());
    }

    public List<String> forCapacity(double projectedEfficiency, Collection<Integer> perResourceCapacity, int resourceCount) {
        List<String> out = new ArrayList<>();
        if (projectedEfficiency < thresholds.lowProjectedEfficiency) {
            out.add("Consider adding more resources or extending the planning period");
        } else if (projectedEfficiency > thresholds.highProjectedEfficiency) {
            out.add("Excellent resource utilization. Consider planning additional processes");
        }
        if (!perResourceCapacity.isEmpty()) {
            int max = perResourceCapacity.stream().mapToInt(Integer::intValue).max().orElse(0);
            int min = perResourceCapacity.stream().mapToInt(Integer::intValue).min().orElse(0);
            if (max - min > thresholds.maxCapacitySpread) {
                out.add("Consider rebalancing the load between resources");
            }
        }
        if (resourceCount < thresholds.minResourceCount) {
            out.add("Consider diversifying resources to reduce risk");
        }
        return out;
    }

    public List<String> forDistribution(DistributionMetrics metrics,
                                        List<Assignment> assignments,
                                        List<Process> unassigned,
                                        int eligibleResources,
                                        boolean optimizeCosts) {
        List<String> out = new ArrayList<>();
        if (!unassigned.isEmpty()) {
            out.add("There are " + unassigned.size()
                    + " unassigned processes. Consider adding resources or relaxing restrictions");
        }
        int unused = eligibleResources - MetricsCalculator.resourcesUsed(assignments);
        if (eligibleResources > 0 && unused > 0) {
            out.add("There are " + unused + " unused resources. Consider reassigning or redistributing the load");
        }
        if (!assignments.isEmpty()) {
            if (metrics.getEfficiency() < thresholds.lowDistributionEfficiency) {
                out.add("Efficiency is low. Consider adjusting the distribution strategy or the restrictions");
            } else if (metrics.getEfficiency() > thresholds.highDistributionEfficiency) {
                out.add("Excellent efficiency. Consider planning additional processes");
            }
        }
        if (optimizeCosts && !assignments.isEmpty()) {
            double average = assignments.stream().mapToDouble(Assignment::getEstimatedCost).average().orElse(0.0);
            if (average > thresholds.highAverageCost) {
                out.add("Costs are high. Consider cheaper resources or reviewing process durations");
            }
        }
        return out;
    }
}
