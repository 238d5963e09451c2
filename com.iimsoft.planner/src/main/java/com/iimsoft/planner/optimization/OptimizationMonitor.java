package com.iimsoft.planner.optimization;

/**
 * Hook polled between search iterations. Returning {@code true} from {@link #shouldStop()} ends the
 * search with its best solution so far, reported as not converged.
 */
public interface OptimizationMonitor {

    OptimizationMonitor NONE = new OptimizationMonitor() {
        @Override
        public void onIteration(OptimizationAlgorithm algorithm, int iteration, double bestObjective) {
        }
    };

    void onIteration(OptimizationAlgorithm algorithm, int iteration, double bestObjective);

    default boolean shouldStop() {
        return false;
    }
}
