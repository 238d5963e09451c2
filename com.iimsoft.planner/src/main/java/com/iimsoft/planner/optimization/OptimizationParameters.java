package com.iimsoft.planner.optimization;

import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;

/**
 * 优化参数：三个权重之和必须为 1（误差 1e-6）
 */
public class OptimizationParameters {

    static final double WEIGHT_SUM_EPSILON = 1e-6;

    public OptimizationAlgorithm algorithm = OptimizationAlgorithm.GREEDY;
    public int maxIterations = 1000;
    public double tolerance = 1e-6;
    public double weightCost = 0.4;
    public double weightTime = 0.3;
    public double weightEfficiency = 0.3;
    public Long randomSeed = null; // null 表示不固定种子

    public static OptimizationParameters of(OptimizationAlgorithm algorithm) {
        OptimizationParameters p = new OptimizationParameters();
        p.algorithm = algorithm;
        return p;
    }

    public OptimizationParameters withSeed(long seed) {
        this.randomSeed = seed;
        return this;
    }

    public OptimizationParameters withWeights(double cost, double time, double efficiency) {
        this.weightCost = cost;
        this.weightTime = time;
        this.weightEfficiency = efficiency;
        return this;
    }

    public void validate() {
        if (algorithm == null) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "algorithm is required");
        }
        if (maxIterations <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "maxIterations must be > 0: " + maxIterations);
        }
        if (!(tolerance > 0)) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "tolerance must be > 0: " + tolerance);
        }
        if (weightCost < 0 || weightTime < 0 || weightEfficiency < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "weights must be >= 0");
        }
        double sum = weightCost + weightTime + weightEfficiency;
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_EPSILON) {
            throw new InvalidInputException(ErrorCode.INVALID_PARAMETERS, "weights must sum to 1.0, got " + sum);
        }
    }

    @Override
    public String toString() {
        return "OptimizationParameters{algorithm=" + algorithm + ", maxIterations=" + maxIterations
                + ", tolerance=" + tolerance + ", weights=" + weightCost + "/" + weightTime + "/" + weightEfficiency
                + ", seed=" + randomSeed + "}";
    }
}
