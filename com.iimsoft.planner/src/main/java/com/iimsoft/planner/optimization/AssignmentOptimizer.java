package com.iimsoft.planner.optimization;

/**
 * One search strategy of {@link ResourceOptimizer}.
 */
public interface AssignmentOptimizer {

    OptimizationAlgorithm algorithm();

    OptimizationResult optimize(OptimizationContext context);
}
