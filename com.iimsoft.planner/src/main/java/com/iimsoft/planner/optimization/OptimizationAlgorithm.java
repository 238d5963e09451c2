package com.iimsoft.planner.optimization;

import java.util.Locale;

public enum OptimizationAlgorithm {
    GREEDY,
    GENETIC,
    SIMULATED_ANNEALING,
    LINEAR,
    BRANCH_AND_BOUND;

    /**
     * Unknown or blank labels map to GREEDY.
     */
    public static OptimizationAlgorithm fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return GREEDY;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (OptimizationAlgorithm a : values()) {
            if (a.name().equals(key)) {
                return a;
            }
        }
        return GREEDY;
    }
}
