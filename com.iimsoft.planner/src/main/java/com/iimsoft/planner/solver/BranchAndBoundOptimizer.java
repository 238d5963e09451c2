package com.iimsoft.planner.solver;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.optimization.AssignmentOptimizer;
import com.iimsoft.planner.optimization.GreedyOptimizer;
import com.iimsoft.planner.optimization.OptimizationAlgorithm;
import com.iimsoft.planner.optimization.OptimizationContext;
import com.iimsoft.planner.optimization.OptimizationParameters;
import com.iimsoft.planner.optimization.OptimizationResult;
import com.iimsoft.planner.optimization.SolutionDecoder;
import org.optaplanner.core.api.solver.Solver;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.exhaustivesearch.ExhaustiveSearchPhaseConfig;
import org.optaplanner.core.config.exhaustivesearch.ExhaustiveSearchType;
import org.optaplanner.core.config.solver.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 分支定界：用 OptaPlanner 穷举搜索（BRANCH_AND_BOUND）在 "工作项 -> 资源" 空间里找最优解。
 * 规模超过上限、求解异常或得不到任何分配时回退到贪心。
 */
public class BranchAndBoundOptimizer implements AssignmentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BranchAndBoundOptimizer.class);

    private final GreedyOptimizer greedy;

    public BranchAndBoundOptimizer(GreedyOptimizer greedy) {
        this.greedy = greedy;
    }

    @Override
    public OptimizationAlgorithm algorithm() {
        return OptimizationAlgorithm.BRANCH_AND_BOUND;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        PlannerSettings.BranchAndBound settings = context.getSettings().getBranchAndBound();
        List<Process> processes = context.getProcesses();
        List<Resource> resources = context.getResources();

        if (processes.size() > settings.maxProcesses) {
            return fallback(context, processes.size() + " processes exceed the exhaustive search limit of " + settings.maxProcesses);
        }

        AllocationPlan problem = buildProblem(processes, resources, context.getParameters());
        Duration limit = Duration.ofSeconds(Math.max(1, settings.timeLimitSeconds));
        SolverFactory<AllocationPlan> solverFactory = SolverFactory.create(buildConfig(limit));

        AllocationPlan solved;
        AtomicInteger improvements = new AtomicInteger();
        long t0 = System.nanoTime();
        try {
            Solver<AllocationPlan> solver = solverFactory.buildSolver();
            solver.addEventListener(event -> improvements.incrementAndGet());
            solved = solver.solve(problem);
        } catch (RuntimeException e) {
            LOGGER.warn("Branch and bound solver failed", e);
            return fallback(context, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        Duration spent = Duration.ofNanos(System.nanoTime() - t0);

        int[] genes = new int[processes.size()];
        Arrays.fill(genes, SolutionDecoder.UNASSIGNED);
        for (ProcessSlot slot : solved.getSlotList()) {
            if (slot.getResource() != null) {
                genes[slot.getId().intValue()] = resources.indexOf(slot.getResource());
            }
        }
        List<Assignment> assignments = context.getDecoder().decode(genes);
        if (assignments.isEmpty()) {
            return fallback(context, "solver produced no feasible assignment, score " + solved.getScore());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("score", String.valueOf(solved.getScore()));
        LOGGER.debug("Branch and bound finished with score {} in {} ms", solved.getScore(), spent.toMillis());
        return OptimizationResult.of(OptimizationAlgorithm.BRANCH_AND_BOUND, assignments,
                context.getObjective().evaluate(assignments), Math.max(1, improvements.get()),
                spent.compareTo(limit) < 0, details);
    }

    static AllocationPlan buildProblem(List<Process> processes, List<Resource> resources, OptimizationParameters params) {
        List<ProcessSlot> slots = new ArrayList<>(processes.size());
        for (int i = 0; i < processes.size(); i++) {
            slots.add(new ProcessSlot((long) i, processes.get(i), params.weightCost, params.weightTime, params.weightEfficiency));
        }
        return new AllocationPlan(new ArrayList<>(resources), slots);
    }

    static SolverConfig buildConfig(Duration limit) {
        ExhaustiveSearchPhaseConfig phase = new ExhaustiveSearchPhaseConfig();
        phase.setExhaustiveSearchType(ExhaustiveSearchType.BRANCH_AND_BOUND);
        return new SolverConfig()
                .withSolutionClass(AllocationPlan.class)
                .withEntityClasses(ProcessSlot.class)
                .withConstraintProviderClass(AllocationConstraintProvider.class)
                .withTerminationSpentLimit(limit)
                .withPhases(phase);
    }

    private OptimizationResult fallback(OptimizationContext context, String reason) {
        LOGGER.warn("Branch and bound unavailable ({}), falling back to greedy", reason);
        return greedy.fallbackFor(OptimizationAlgorithm.BRANCH_AND_BOUND, context, reason);
    }
}
