package com.iimsoft.planner.optimization;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 超时监视器：超过截止时间后要求搜索停止
 */
public class DeadlineMonitor implements OptimizationMonitor {

    private final Clock clock;
    private final Instant deadline;
    private int lastIteration;
    private double lastBest = Double.POSITIVE_INFINITY;

    public DeadlineMonitor(Clock clock, Duration budget) {
        this.clock = clock;
        this.deadline = clock.instant().plus(budget);
    }

    @Override
    public void onIteration(OptimizationAlgorithm algorithm, int iteration, double bestObjective) {
        lastIteration = iteration;
        lastBest = bestObjective;
    }

    @Override
    public boolean shouldStop() {
        return clock.instant().isAfter(deadline);
    }

    public int getLastIteration() { return lastIteration; }
    public double getLastBest() { return lastBest; }
}
