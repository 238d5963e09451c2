package com.iimsoft.planner.optimization;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 线性规划松弛：
 * <pre>
 * 变量   x[i][j] ∈ [0, 1]，工作项 i 分给资源 j 的比例
 * 目标   min Σ c[i][j] · x[i][j]，c 为加权的成本、工时与效率
 * 约束   Σ_j x[i][j] = 1                每个工作项恰好分配一次
 *        Σ_i hours[i] · x[i][j] <= cap[j] 资源剩余容量
 *        x[i][j] <= 0                    能力不符或资源不可用
 * </pre>
 * 没有整数约束，结果按阈值取整：每个工作项取第一个超过阈值的资源，可能一个都没有。
 * 求解失败或无可行解时回退到贪心。
 */
public class LinearRelaxationOptimizer implements AssignmentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearRelaxationOptimizer.class);

    public static final String LP_OBJECTIVE = "lpObjective";

    private final GreedyOptimizer greedy;

    public LinearRelaxationOptimizer(GreedyOptimizer greedy) {
        this.greedy = greedy;
    }

    @Override
    public OptimizationAlgorithm algorithm() {
        return OptimizationAlgorithm.LINEAR;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        PlannerSettings.Linear settings = context.getSettings().getLinear();
        List<Process> processes = context.getProcesses();
        List<Resource> resources = context.getResources();
        int nP = processes.size();
        int nR = resources.size();

        LinearObjectiveFunction objective = new LinearObjectiveFunction(coefficients(context), 0.0);
        List<LinearConstraint> constraints = constraints(context);

        SimplexSolver solver = new SimplexSolver();
        PointValuePair solution;
        try {
            solution = solver.optimize(
                    new MaxIter(settings.maxSolverIterations),
                    objective,
                    new LinearConstraintSet(constraints),
                    GoalType.MINIMIZE,
                    new NonNegativeConstraint(true));
        } catch (MathIllegalStateException e) {
            // 无可行解、无界或迭代超限
            return fallback(context, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        double[] x = solution.getPoint();
        int[] genes = new int[nP];
        Arrays.fill(genes, SolutionDecoder.UNASSIGNED);
        for (int i = 0; i < nP; i++) {
            for (int j = 0; j < nR; j++) {
                if (x[i * nR + j] > settings.assignmentThreshold) {
                    genes[i] = j;
                    break;
                }
            }
        }
        List<Assignment> assignments = context.getDecoder().decode(genes);
        if (assignments.isEmpty()) {
            return fallback(context, "no variable above threshold " + settings.assignmentThreshold);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(LP_OBJECTIVE, solution.getValue());
        details.put("assignmentThreshold", settings.assignmentThreshold);
        LOGGER.debug("LP relaxation solved in {} iterations, lp objective {}", solver.getIterations(), solution.getValue());
        return OptimizationResult.of(OptimizationAlgorithm.LINEAR, assignments,
                context.getObjective().evaluate(assignments), solver.getIterations(), true, details);
    }

    private double[] coefficients(OptimizationContext context) {
        List<Process> processes = context.getProcesses();
        List<Resource> resources = context.getResources();
        int nR = resources.size();
        double[] c = new double[processes.size() * nR];
        for (int i = 0; i < processes.size(); i++) {
            Process p = processes.get(i);
            for (int j = 0; j < nR; j++) {
                Resource r = resources.get(j);
                c[i * nR + j] = context.getObjective().pairCost(p.getEstimatedHours(), r.getCostPerHour(),
                        r.getAvailableCapacity(), r.getMaxCapacity());
            }
        }
        return c;
    }

    private List<LinearConstraint> constraints(OptimizationContext context) {
        List<Process> processes = context.getProcesses();
        List<Resource> resources = context.getResources();
        int nP = processes.size();
        int nR = resources.size();
        int n = nP * nR;
        List<LinearConstraint> out = new ArrayList<>();

        for (int i = 0; i < nP; i++) {
            double[] row = new double[n];
            for (int j = 0; j < nR; j++) row[i * nR + j] = 1.0;
            out.add(new LinearConstraint(row, Relationship.EQ, 1.0));
        }
        for (int j = 0; j < nR; j++) {
            double[] row = new double[n];
            for (int i = 0; i < nP; i++) row[i * nR + j] = processes.get(i).getEstimatedHours();
            out.add(new LinearConstraint(row, Relationship.LEQ, resources.get(j).getAvailableCapacity()));
        }
        for (int i = 0; i < nP; i++) {
            for (int j = 0; j < nR; j++) {
                double[] row = new double[n];
                row[i * nR + j] = 1.0;
                Resource r = resources.get(j);
                boolean open = r.isAvailable() && context.getFilter().isCompatible(processes.get(i), r);
                out.add(new LinearConstraint(row, Relationship.LEQ, open ? 1.0 : 0.0));
            }
        }
        return out;
    }

    private OptimizationResult fallback(OptimizationContext context, String reason) {
        LOGGER.warn("Linear relaxation failed ({}), falling back to greedy", reason);
        return greedy.fallbackFor(OptimizationAlgorithm.LINEAR, context, reason);
    }
}
