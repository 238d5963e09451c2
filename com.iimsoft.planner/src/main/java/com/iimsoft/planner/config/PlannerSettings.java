package com.iimsoft.planner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunables of the search algorithms and thresholds of the recommendation rules.
 * Every field has a default, so a partial JSON document only overrides what it names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerSettings {

    @JsonProperty("annealing")
    private Annealing annealing = new Annealing();

    @JsonProperty("genetic")
    private Genetic genetic = new Genetic();

    @JsonProperty("linear")
    private Linear linear = new Linear();

    @JsonProperty("branchAndBound")
    private BranchAndBound branchAndBound = new BranchAndBound();

    @JsonProperty("recommendations")
    private Recommendations recommendations = new Recommendations();

    public static PlannerSettings defaults() {
        return new PlannerSettings();
    }

    public Annealing getAnnealing() { return annealing; }
    public void setAnnealing(Annealing annealing) { this.annealing = annealing == null ? new Annealing() : annealing; }
    public Genetic getGenetic() { return genetic; }
    public void setGenetic(Genetic genetic) { this.genetic = genetic == null ? new Genetic() : genetic; }
    public Linear getLinear() { return linear; }
    public void setLinear(Linear linear) { this.linear = linear == null ? new Linear() : linear; }
    public BranchAndBound getBranchAndBound() { return branchAndBound; }
    public void setBranchAndBound(BranchAndBound branchAndBound) { this.branchAndBound = branchAndBound == null ? new BranchAndBound() : branchAndBound; }
    public Recommendations getRecommendations() { return recommendations; }
    public void setRecommendations(Recommendations recommendations) { this.recommendations = recommendations == null ? new Recommendations() : recommendations; }

    /**
     * Geometric cooling schedule of simulated annealing.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Annealing {
        @JsonProperty("initialTemperature")
        public double initialTemperature = 1000.0;
        @JsonProperty("finalTemperature")
        public double finalTemperature = 0.1;
        @JsonProperty("coolingFactor")
        public double coolingFactor = 0.95;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Genetic {
        @JsonProperty("populationSize")
        public int populationSize = 50;
        @JsonProperty("tournamentSize")
        public int tournamentSize = 3;
        @JsonProperty("crossoverRate")
        public double crossoverRate = 0.8;
        // 单基因变异率
        @JsonProperty("mutationRate")
        public double mutationRate = 0.1;
        // 精英保留，0 表示不保留
        @JsonProperty("eliteCount")
        public int eliteCount = 0;
        // 超过该代数后才允许按 tolerance 早停
        @JsonProperty("earlyStopGeneration")
        public int earlyStopGeneration = 100;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Linear {
        @JsonProperty("assignmentThreshold")
        public double assignmentThreshold = 0.5;
        @JsonProperty("maxSolverIterations")
        public int maxSolverIterations = 10_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BranchAndBound {
        @JsonProperty("maxProcesses")
        public int maxProcesses = 12;
        @JsonProperty("timeLimitSeconds")
        public long timeLimitSeconds = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Recommendations {
        // capacity
        @JsonProperty("lowProjectedEfficiency")
        public double lowProjectedEfficiency = 50.0;
        @JsonProperty("highProjectedEfficiency")
        public double highProjectedEfficiency = 90.0;
        @JsonProperty("maxCapacitySpread")
        public int maxCapacitySpread = 5;
        @JsonProperty("minResourceCount")
        public int minResourceCount = 3;
        // distribution
        @JsonProperty("lowDistributionEfficiency")
        public double lowDistributionEfficiency = 60.0;
        @JsonProperty("highDistributionEfficiency")
        public double highDistributionEfficiency = 90.0;
        @JsonProperty("highAverageCost")
        public double highAverageCost = 1000.0;
    }
}
