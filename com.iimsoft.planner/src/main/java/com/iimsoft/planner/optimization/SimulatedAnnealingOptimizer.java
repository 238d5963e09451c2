package com.iimsoft.planner.optimization;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 模拟退火：
 * - 初始解 = 贪心解
 * - 邻域 = 随机挑一个已分配的工作项，改派到随机资源（该资源放得下才改）
 * - 更优解无条件接受，更差解以 exp(-Δ/T) 概率接受
 * - 温度按几何系数下降，低于终止温度即收敛
 */
public class SimulatedAnnealingOptimizer implements AssignmentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedAnnealingOptimizer.class);

    private final GreedyOptimizer greedy;

    public SimulatedAnnealingOptimizer(GreedyOptimizer greedy) {
        this.greedy = greedy;
    }

    @Override
    public OptimizationAlgorithm algorithm() {
        return OptimizationAlgorithm.SIMULATED_ANNEALING;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        PlannerSettings.Annealing schedule = context.getSettings().getAnnealing();
        SolutionDecoder decoder = context.getDecoder();
        ObjectiveFunction objective = context.getObjective();
        OptimizationMonitor monitor = context.getMonitor();
        Random rnd = context.getRandom();

        int[] current = decoder.encode(greedy.allocate(context));
        double currentValue = objective.evaluate(decoder.decode(current));
        int[] best = current.clone();
        double bestValue = currentValue;

        double temperature = schedule.initialTemperature;
        boolean converged = false;
        int iterations = 0;

        for (int it = 1; it <= context.getParameters().maxIterations; it++) {
            if (monitor.shouldStop()) {
                LOGGER.debug("Annealing stopped by monitor after {} iterations", iterations);
                break;
            }
            int[] neighbour = neighbour(current, decoder, rnd);
            double neighbourValue = objective.evaluate(decoder.decode(neighbour));

            if (neighbourValue < currentValue) {
                current = neighbour;
                currentValue = neighbourValue;
                if (neighbourValue < bestValue) {
                    best = neighbour.clone();
                    bestValue = neighbourValue;
                }
            } else if (rnd.nextDouble() < acceptance(neighbourValue - currentValue, temperature)) {
                current = neighbour;
                currentValue = neighbourValue;
            }

            iterations = it;
            temperature *= schedule.coolingFactor;
            monitor.onIteration(OptimizationAlgorithm.SIMULATED_ANNEALING, it, bestValue);
            if (temperature < schedule.finalTemperature) {
                converged = true;
                break;
            }
        }

        List<Assignment> assignments = decoder.decode(best);
        LOGGER.debug("Annealing finished: {} iterations, T={}, best={}", iterations, temperature, bestValue);
        return OptimizationResult.of(OptimizationAlgorithm.SIMULATED_ANNEALING, assignments,
                objective.evaluate(assignments), iterations, converged);
    }

    /**
     * Metropolis criterion. A NaN delta (infinity minus infinity) is never accepted.
     */
    static double acceptance(double delta, double temperature) {
        if (Double.isNaN(delta)) {
            return 0.0;
        }
        return Math.exp(-delta / temperature);
    }

    private static int[] neighbour(int[] genes, SolutionDecoder decoder, Random rnd) {
        int[] next = genes.clone();
        List<Integer> assigned = new ArrayList<>();
        for (int i = 0; i < genes.length; i++) {
            if (genes[i] >= 0) assigned.add(i);
        }
        if (assigned.isEmpty() || decoder.resourceCount() == 0) {
            return next;
        }
        int p = assigned.get(rnd.nextInt(assigned.size()));
        int r = rnd.nextInt(decoder.resourceCount());
        if (decoder.isPlaceable(p, r)) {
            next[p] = r;
        }
        return next;
    }
}
