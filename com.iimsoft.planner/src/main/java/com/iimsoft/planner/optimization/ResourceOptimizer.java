package com.iimsoft.planner.optimization;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import com.iimsoft.planner.error.OptimizationFailedException;
import com.iimsoft.planner.optimization.ga.GeneticAlgorithmOptimizer;
import com.iimsoft.planner.solver.BranchAndBoundOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 优化入口：校验参数，按算法分派，计时并包装异常。
 * 每次调用构建独立的 {@link OptimizationContext}（随机数、台账均不跨调用共享）。
 */
public class ResourceOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceOptimizer.class);

    private final PlannerSettings settings;
    private final Clock clock;
    private final Map<OptimizationAlgorithm, AssignmentOptimizer> optimizers = new EnumMap<>(OptimizationAlgorithm.class);

    public ResourceOptimizer(PlannerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        GreedyOptimizer greedy = new GreedyOptimizer();
        register(greedy);
        register(new SimulatedAnnealingOptimizer(greedy));
        register(new GeneticAlgorithmOptimizer());
        register(new LinearRelaxationOptimizer(greedy));
        register(new BranchAndBoundOptimizer(greedy));
    }

    private void register(AssignmentOptimizer optimizer) {
        optimizers.put(optimizer.algorithm(), optimizer);
    }

    public OptimizationResult optimize(List<Process> processes, List<Resource> resources, OptimizationParameters params) {
        return optimize(processes, resources, params, OptimizationMonitor.NONE);
    }

    public OptimizationResult optimize(List<Process> processes, List<Resource> resources,
                                       OptimizationParameters params, OptimizationMonitor monitor) {
        if (processes == null || processes.isEmpty()) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "At least one process is required");
        }
        if (resources == null || resources.isEmpty()) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "At least one resource is required");
        }
        if (params == null) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "Optimization parameters are required");
        }
        params.validate();

        LOGGER.info("Optimizing {} processes over {} resources with {}", processes.size(), resources.size(), params);
        long t0 = System.nanoTime();
        try {
            OptimizationContext context = new OptimizationContext(processes, resources, params, settings,
                    LocalDateTime.now(clock), monitor);
            OptimizationResult result = optimizers.get(params.algorithm).optimize(context)
                    .withElapsed(Duration.ofNanos(System.nanoTime() - t0));
            LOGGER.info("Optimization done: algorithm={}, assignments={}, objective={}, iterations={}, converged={}, {} ms",
                    result.getAlgorithmUsed(), result.getAssignments().size(), result.getObjectiveValue(),
                    result.getIterations(), result.isConverged(), result.getElapsed().toMillis());
            return result;
        } catch (InvalidInputException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.error("Optimization with {} failed", params.algorithm, e);
            throw new OptimizationFailedException("Optimization with " + params.algorithm + " failed: " + e.getMessage(), e);
        }
    }
}
