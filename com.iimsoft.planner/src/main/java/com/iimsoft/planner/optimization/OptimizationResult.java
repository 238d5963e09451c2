package com.iimsoft.planner.optimization;

import com.iimsoft.planner.domain.Assignment;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Answer of one optimization call. {@code algorithmUsed} differs from the requested algorithm after a fallback.
 */
@Value
public class OptimizationResult {

    public static final String FALLBACK_FROM = "fallbackFrom";
    public static final String FALLBACK_REASON = "fallbackReason";

    List<Assignment> assignments;
    double objectiveValue;
    @With
    Duration elapsed;
    int iterations;
    boolean converged;
    OptimizationAlgorithm algorithmUsed;
    SolutionMetrics metrics;
    // 求解器相关的附加信息，例如 LP 目标值、回退原因
    Map<String, Object> details;

    public static OptimizationResult of(OptimizationAlgorithm algorithm, List<Assignment> assignments, double objective,
                                        int iterations, boolean converged, Map<String, Object> details) {
        return new OptimizationResult(Collections.unmodifiableList(assignments), objective, Duration.ZERO, iterations,
                converged, algorithm, SolutionMetrics.of(assignments), Collections.unmodifiableMap(details));
    }

    public static OptimizationResult of(OptimizationAlgorithm algorithm, List<Assignment> assignments, double objective,
                                        int iterations, boolean converged) {
        return of(algorithm, assignments, objective, iterations, converged, Collections.emptyMap());
    }
}
