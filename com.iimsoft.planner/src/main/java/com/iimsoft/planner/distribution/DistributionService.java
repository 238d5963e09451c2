package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.AllocationFailedException;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import com.iimsoft.planner.metrics.DistributionMetrics;
import com.iimsoft.planner.metrics.MetricsCalculator;
import com.iimsoft.planner.metrics.RecommendationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 资源分配服务：校验 -> 过滤资源 -> 排序工作项 -> 贪心分配 -> 指标与建议。
 * <p>
 * 校验失败直接抛出 {@link InvalidInputException}；其余运行期异常包装为 {@link AllocationFailedException}，
 * 不返回部分结果。
 */
public class DistributionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DistributionService.class);

    private final ConstraintFilter filter;
    private final ScoringModel scoringModel;
    private final GreedyAllocator allocator;
    private final MetricsCalculator metricsCalculator;
    private final RecommendationGenerator recommendationGenerator;
    private final Clock clock;

    public DistributionService(ConstraintFilter filter,
                               ScoringModel scoringModel,
                               MetricsCalculator metricsCalculator,
                               RecommendationGenerator recommendationGenerator,
                               Clock clock) {
        this.filter = filter;
        this.scoringModel = scoringModel;
        this.allocator = new GreedyAllocator(filter, AssignmentTimeline.DAYS);
        this.metricsCalculator = metricsCalculator;
        this.recommendationGenerator = recommendationGenerator;
        this.clock = clock;
    }

    public DistributionService(Clock clock) {
        this(new ConstraintFilter(), new ScoringModel(), new MetricsCalculator(), new RecommendationGenerator(), clock);
    }

    public DistributionResult distribute(DistributionRequest request) {
        List<Process> processes = request.getProcesses();
        List<Resource> resources = request.getResources();
        if (processes == null || processes.isEmpty()) {
            throw new InvalidInputException(ErrorCode.NO_PROCESSES, "At least one process is required");
        }
        if (resources == null || resources.isEmpty()) {
            throw new InvalidInputException(ErrorCode.NO_RESOURCES, "At least one resource is required");
        }
        DistributionConstraints constraints = request.getConstraints() == null
                ? DistributionConstraints.none() : request.getConstraints();
        filter.validate(processes, constraints);

        long t0 = System.currentTimeMillis();
        LOGGER.info("Distributing {} processes over {} resources, strategy={}",
                processes.size(), resources.size(), request.getStrategy());
        try {
            LocalDateTime base = request.getBaseStart() != null ? request.getBaseStart() : LocalDateTime.now(clock);
            List<Resource> eligible = filter.filterResources(resources, constraints);
            List<Process> ordered = filter.orderProcesses(processes, resources, request.getStrategy(), constraints);

            AllocationOutcome outcome = allocator.allocate(ordered, eligible,
                    scoringModel.scorerFor(request.getStrategy()), constraints, base);

            List<Process> unassigned = unassignedInInputOrder(processes, outcome.getAssignments());
            DistributionMetrics metrics = metricsCalculator.distribution(outcome.getAssignments(), resources.size());
            List<String> recommendations = recommendationGenerator.forDistribution(metrics, outcome.getAssignments(),
                    unassigned, eligible.size(), request.isOptimizeCosts());

            LOGGER.info("Distribution done: {} assigned, {} unassigned, {} ms",
                    outcome.getAssignments().size(), unassigned.size(), System.currentTimeMillis() - t0);
            return new DistributionResult(request.getStrategy(), outcome.getAssignments(), unassigned, metrics, recommendations);
        } catch (InvalidInputException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.error("Distribution failed", e);
            throw new AllocationFailedException("Resource distribution failed: " + e.getMessage(), e);
        }
    }

    private static List<Process> unassignedInInputOrder(List<Process> processes, List<Assignment> assignments) {
        Set<String> assigned = new HashSet<>();
        for (Assignment a : assignments) {
            assigned.add(a.getProcessId());
        }
        List<Process> out = new ArrayList<>();
        for (Process p : processes) {
            if (!assigned.contains(p.getId())) {
                out.add(p);
            }
        }
        return out;
    }
}
