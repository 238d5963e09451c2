package com.iimsoft.planner.service;

import com.iimsoft.planner.capacity.CapacityEstimator;
import com.iimsoft.planner.capacity.CapacityReport;
import com.iimsoft.planner.capacity.PlanningWindow;
import com.iimsoft.planner.capacity.ProcessCatalog;
import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.distribution.ConstraintFilter;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.distribution.DistributionRequest;
import com.iimsoft.planner.distribution.DistributionResult;
import com.iimsoft.planner.distribution.DistributionService;
import com.iimsoft.planner.distribution.DistributionStrategy;
import com.iimsoft.planner.distribution.ScoringModel;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.metrics.MetricsCalculator;
import com.iimsoft.planner.metrics.RecommendationGenerator;
import com.iimsoft.planner.optimization.OptimizationMonitor;
import com.iimsoft.planner.optimization.OptimizationParameters;
import com.iimsoft.planner.optimization.OptimizationResult;
import com.iimsoft.planner.optimization.ResourceOptimizer;

import java.time.Clock;
import java.util.List;

/**
 * 对外入口：产能估算、资源分配、分配优化三种调用。
 * <p>
 * 不持有跨调用的可变状态；同一资源池上的并发调用需由调用方串行化。
 */
public class PlanningService {

    private final CapacityEstimator capacityEstimator;
    private final DistributionService distributionService;
    private final ResourceOptimizer resourceOptimizer;

    public PlanningService(PlannerSettings settings, Clock clock, ProcessCatalog catalog) {
        RecommendationGenerator recommendations = new RecommendationGenerator(settings.getRecommendations());
        this.capacityEstimator = new CapacityEstimator(catalog, recommendations, clock);
        this.distributionService = new DistributionService(new ConstraintFilter(), new ScoringModel(),
                new MetricsCalculator(), recommendations, clock);
        this.resourceOptimizer = new ResourceOptimizer(settings, clock);
    }

    public PlanningService(PlannerSettings settings, Clock clock) {
        this(settings, clock, null);
    }

    public CapacityReport computeCapacity(PlanningWindow window, List<Resource> resources, DistributionConstraints restrictions) {
        return capacityEstimator.estimate(window, resources, restrictions);
    }

    public CapacityReport computeCapacity(PlanningWindow window, List<Resource> resources,
                                          List<Process> processes, DistributionConstraints restrictions) {
        return capacityEstimator.estimate(window, resources, processes, restrictions);
    }

    public DistributionResult distribute(List<Process> processes, List<Resource> resources,
                                         DistributionStrategy strategy, DistributionConstraints restrictions) {
        return distribute(DistributionRequest.builder()
                .processes(processes)
                .resources(resources)
                .strategy(strategy)
                .constraints(restrictions == null ? DistributionConstraints.none() : restrictions)
                .build());
    }

    public DistributionResult distribute(DistributionRequest request) {
        return distributionService.distribute(request);
    }

    public OptimizationResult optimize(List<Process> processes, List<Resource> resources, OptimizationParameters params) {
        return resourceOptimizer.optimize(processes, resources, params);
    }

    public OptimizationResult optimize(List<Process> processes, List<Resource> resources,
                                       OptimizationParameters params, OptimizationMonitor monitor) {
        return resourceOptimizer.optimize(processes, resources, params, monitor);
    }
}
