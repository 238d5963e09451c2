package com.iimsoft.planner.optimization;

import com.iimsoft.planner.distribution.AllocationOutcome;
import com.iimsoft.planner.distribution.AssignmentTimeline;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.distribution.GreedyAllocator;
import com.iimsoft.planner.distribution.ResourceScorer;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 贪心基线：按综合键（优先级、工时倒数、成本倒数加权）降序处理工作项，
 * 每个工作项取加权成本最低的可行资源。单次迭代，总是视为收敛。
 */
public class GreedyOptimizer implements AssignmentOptimizer {

    @Override
    public OptimizationAlgorithm algorithm() {
        return OptimizationAlgorithm.GREEDY;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        List<Assignment> assignments = allocate(context);
        return OptimizationResult.of(OptimizationAlgorithm.GREEDY, assignments,
                context.getObjective().evaluate(assignments), 1, true);
    }

    /**
     * Greedy answer standing in for an algorithm that could not produce one.
     */
    public OptimizationResult fallbackFor(OptimizationAlgorithm requested, OptimizationContext context, String reason) {
        List<Assignment> assignments = allocate(context);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(OptimizationResult.FALLBACK_FROM, requested.name());
        details.put(OptimizationResult.FALLBACK_REASON, reason);
        return OptimizationResult.of(OptimizationAlgorithm.GREEDY, assignments,
                context.getObjective().evaluate(assignments), 1, true, details);
    }

    /**
     * Greedy assignment set, also the starting point of simulated annealing.
     */
    public List<Assignment> allocate(OptimizationContext context) {
        ObjectiveFunction objective = context.getObjective();
        List<Process> ordered = order(context.getProcesses(), context.getResources(), objective);

        // 分配器取分数最大者，这里对加权成本取负
        ResourceScorer scorer = (process, resource, ledger) -> -objective.pairCost(process.getEstimatedHours(),
                resource.getCostPerHour(), resource.getAvailableCapacity(), resource.getMaxCapacity());

        GreedyAllocator allocator = new GreedyAllocator(context.getFilter(), AssignmentTimeline.HOURS);
        AllocationOutcome outcome = allocator.allocate(ordered, context.getResources(), scorer,
                DistributionConstraints.none(), context.getBaseStart());
        return outcome.getAssignments();
    }

    static List<Process> order(List<Process> processes, List<Resource> resources, ObjectiveFunction objective) {
        double cheapest = resources.stream()
                .mapToDouble(Resource::getCostPerHour)
                .filter(c -> c > 0)
                .min()
                .orElse(0.0);
        List<Process> ordered = new ArrayList<>(processes);
        ordered.sort(Comparator.comparingDouble((Process p) -> sortKey(p, cheapest, objective)).reversed());
        return ordered;
    }

    static double sortKey(Process process, double cheapestRate, ObjectiveFunction objective) {
        double hours = process.getEstimatedHours();
        double estimatedCost = cheapestRate * hours;
        double costTerm = estimatedCost > 0 ? objective.getWeightCost() / estimatedCost : 0.0;
        return process.getPriority().getValue() * objective.getWeightEfficiency()
                + objective.getWeightTime() / hours
                + costTerm;
    }
}
