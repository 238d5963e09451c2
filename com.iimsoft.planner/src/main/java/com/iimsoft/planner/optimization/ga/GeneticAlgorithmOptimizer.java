package com.iimsoft.planner.optimization.ga;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.optimization.AssignmentOptimizer;
import com.iimsoft.planner.optimization.ObjectiveFunction;
import com.iimsoft.planner.optimization.OptimizationAlgorithm;
import com.iimsoft.planner.optimization.OptimizationContext;
import com.iimsoft.planner.optimization.OptimizationMonitor;
import com.iimsoft.planner.optimization.OptimizationResult;
import com.iimsoft.planner.optimization.SolutionDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * 遗传算法求解器：
 * - 基因 = 每个工作项对应的资源下标（直接编码）
 * - 适应度 = 目标函数值（越小越好），不可行基因在解码时丢弃
 * - 选择 = 锦标赛
 * - 交叉 = 均匀交叉
 * - 变异 = 逐基因按概率重抽资源下标
 * <p>
 * 单线程评估，同一种子下结果可复现。
 */
public class GeneticAlgorithmOptimizer implements AssignmentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneticAlgorithmOptimizer.class);

    @Override
    public OptimizationAlgorithm algorithm() {
        return OptimizationAlgorithm.GENETIC;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        PlannerSettings.Genetic params = context.getSettings().getGenetic();
        SolutionDecoder decoder = context.getDecoder();
        ObjectiveFunction objective = context.getObjective();
        OptimizationMonitor monitor = context.getMonitor();
        Random rnd = context.getRandom();
        double tolerance = context.getParameters().tolerance;

        int nGenes = decoder.processCount();
        int nResources = decoder.resourceCount();
        int populationSize = Math.max(2, params.populationSize);
        int tournamentSize = Math.max(1, params.tournamentSize);

        // 生成种群
        List<Genome> population = new ArrayList<>(populationSize);
        for (int k = 0; k < populationSize; k++) {
            Genome g = randomGenome(nGenes, nResources, rnd);
            evaluate(g, decoder, objective);
            population.add(g);
        }
        population.sort(Comparator.comparingDouble((Genome g) -> g.fitness));
        Genome globalBest = population.get(0).copy();

        // 演化
        int generation = 0;
        boolean stoppedEarly = false;
        for (int gen = 1; gen <= context.getParameters().maxIterations; gen++) {
            if (monitor.shouldStop()) {
                stoppedEarly = true;
                LOGGER.debug("GA stopped by monitor at generation {}", generation);
                break;
            }
            List<Genome> next = new ArrayList<>(populationSize);

            // 精英保留
            int elites = Math.min(params.eliteCount, population.size());
            for (int i = 0; i < elites; i++) {
                next.add(population.get(i).copy());
            }

            // 产生后代
            while (next.size() < populationSize) {
                Genome c1 = tournamentSelect(population, tournamentSize, rnd).copy();
                Genome c2 = tournamentSelect(population, tournamentSize, rnd).copy();

                if (rnd.nextDouble() < params.crossoverRate) {
                    uniformCrossover(c1, c2, rnd);
                }
                mutate(c1, params.mutationRate, nResources, rnd);
                mutate(c2, params.mutationRate, nResources, rnd);

                next.add(c1);
                if (next.size() < populationSize) next.add(c2);
            }

            // 评估
            for (Genome g : next) {
                evaluate(g, decoder, objective);
            }
            next.sort(Comparator.comparingDouble((Genome g) -> g.fitness));

            Genome best = next.get(0);
            if (best.fitness < globalBest.fitness) {
                globalBest = best.copy();
            }
            population = next;
            generation = gen;
            monitor.onIteration(OptimizationAlgorithm.GENETIC, gen, globalBest.fitness);

            // 早停
            if (gen > params.earlyStopGeneration && Math.abs(globalBest.fitness) < tolerance) {
                LOGGER.debug("GA early stop at generation {}, best={}", gen, globalBest.fitness);
                break;
            }
        }

        List<Assignment> assignments = decoder.decode(globalBest.genes);
        boolean converged = !stoppedEarly && Math.abs(globalBest.fitness) < tolerance;
        return OptimizationResult.of(OptimizationAlgorithm.GENETIC, assignments,
                objective.evaluate(assignments), generation, converged);
    }

    // ============ Genome ============

    private static class Genome {
        final int[] genes; // 资源下标
        double fitness = Double.POSITIVE_INFINITY;

        Genome(int n) {
            this.genes = new int[n];
        }

        Genome copy() {
            Genome g = new Genome(genes.length);
            System.arraycopy(this.genes, 0, g.genes, 0, genes.length);
            g.fitness = this.fitness;
            return g;
        }
    }

    private static Genome randomGenome(int nGenes, int nResources, Random rnd) {
        Genome g = new Genome(nGenes);
        for (int i = 0; i < nGenes; i++) {
            g.genes[i] = rnd.nextInt(nResources);
        }
        return g;
    }

    private static void evaluate(Genome g, SolutionDecoder decoder, ObjectiveFunction objective) {
        g.fitness = objective.evaluate(decoder.decode(g.genes));
    }

    private static void uniformCrossover(Genome a, Genome b, Random rnd) {
        for (int i = 0; i < a.genes.length; i++) {
            if (rnd.nextBoolean()) {
                int t = a.genes[i]; a.genes[i] = b.genes[i]; b.genes[i] = t;
            }
        }
    }

    private static void mutate(Genome g, double mutationRate, int nResources, Random rnd) {
        for (int i = 0; i < g.genes.length; i++) {
            if (rnd.nextDouble() < mutationRate) {
                g.genes[i] = rnd.nextInt(nResources);
            }
        }
    }

    /** 最小化：取锦标赛中适应度最小者 */
    private static Genome tournamentSelect(List<Genome> pop, int k, Random rnd) {
        Genome best = null;
        for (int i = 0; i < k; i++) {
            Genome g = pop.get(rnd.nextInt(pop.size()));
            if (best == null || g.fitness < best.fitness) {
                best = g;
            }
        }
        return best;
    }
}
