package com.iimsoft.planner.optimization;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.metrics.MetricsCalculator;

import java.util.List;

/**
 * 目标函数（越小越好）：
 * <pre>
 * wc * (totalCost / n) + wt * (makespan / n) - we * (n / makespan)
 * </pre>
 * 空解为正无穷；makespan 为 0 时效率项取 0。
 */
public class ObjectiveFunction {

    private final double weightCost;
    private final double weightTime;
    private final double weightEfficiency;

    public ObjectiveFunction(double weightCost, double weightTime, double weightEfficiency) {
        this.weightCost = weightCost;
        this.weightTime = weightTime;
        this.weightEfficiency = weightEfficiency;
    }

    public static ObjectiveFunction of(OptimizationParameters params) {
        return new ObjectiveFunction(params.weightCost, params.weightTime, params.weightEfficiency);
    }

    public double evaluate(List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        int n = assignments.size();
        double totalCost = 0.0;
        for (Assignment a : assignments) {
            totalCost += a.getEstimatedCost();
        }
        double makespan = MetricsCalculator.spanHours(assignments);
        double efficiency = makespan > 0 ? n / makespan : 0.0;
        return weightCost * (totalCost / n) + weightTime * (makespan / n) - weightEfficiency * efficiency;
    }

    /**
     * Per-pair estimate used by the greedy scorer and the LP coefficients: weighted cost and hours
     * minus the weighted share of capacity still free on the resource.
     */
    public double pairCost(double hours, double costPerHour, double availableCapacity, double maxCapacity) {
        return weightCost * hours * costPerHour + weightTime * hours - weightEfficiency * (availableCapacity / maxCapacity);
    }

    public double getWeightCost() { return weightCost; }
    public double getWeightTime() { return weightTime; }
    public double getWeightEfficiency() { return weightEfficiency; }
}
