package com.iimsoft.planner.capacity;

import com.iimsoft.planner.calendar.WorkingDays;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.AllocationFailedException;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import com.iimsoft.planner.metrics.RecommendationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 产能估算：
 * - 工作日 = [start, end) 内的周一至周五（周末一律不计）
 * - 资源可用工时 = 每日工时 × 工作日，可被 maxHoursPerResource 封顶
 * - 资源可容纳工作项数 = floor(可用工时 / 平均工时)，没有工作项样本时为 0
 */
public class CapacityEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapacityEstimator.class);

    private final ProcessCatalog catalog;
    private final RecommendationGenerator recommendations;
    private final Clock clock;

    public CapacityEstimator(ProcessCatalog catalog, RecommendationGenerator recommendations, Clock clock) {
        this.catalog = catalog;
        this.recommendations = Objects.requireNonNull(recommendations, "recommendations");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Estimates with the process sample pulled from the catalog.
     */
    public CapacityReport estimate(PlanningWindow window, List<Resource> resources, DistributionConstraints constraints) {
        if (catalog == null) {
            throw new IllegalStateException("No process catalog configured; pass the processes explicitly");
        }
        validate(window, resources, constraints);
        List<Process> processes;
        try {
            processes = catalog.findActive();
        } catch (RuntimeException e) {
            LOGGER.error("Loading active processes failed", e);
            throw new AllocationFailedException("Capacity estimation failed: " + e.getMessage(), e);
        }
        if (processes == null) {
            throw new AllocationFailedException("Capacity estimation failed: process catalog returned no result", null);
        }
        LOGGER.debug("Catalog returned {} active processes", processes.size());
        return estimate(window, resources, processes, constraints);
    }

    public CapacityReport estimate(PlanningWindow window, List<Resource> resources,
                                   List<Process> processes, DistributionConstraints constraints) {
        DistributionConstraints c = constraints == null ? DistributionConstraints.none() : constraints;
        validate(window, resources, c);
        LOGGER.info("Estimating capacity for {} - {} over {} resources", window.getStart(), window.getEnd(), resources.size());
        try {
            return compute(window, resources, processes == null ? Collections.emptyList() : processes, c);
        } catch (RuntimeException e) {
            LOGGER.error("Capacity estimation failed", e);
            throw new AllocationFailedException("Capacity estimation failed: " + e.getMessage(), e);
        }
    }

    private CapacityReport compute(PlanningWindow window, List<Resource> resources,
                                   List<Process> processes, DistributionConstraints constraints) {
        int workingDays = WorkingDays.between(window.getStart(), window.getEnd());

        List<Resource> usable = new ArrayList<>();
        for (Resource r : resources) {
            if (!constraints.isForbidden(r.getId()) && constraints.isAllowedByMandatory(r.getId())) {
                usable.add(r);
            }
        }

        double averageHours = processes.stream().mapToDouble(Process::getEstimatedHours).average().orElse(0.0);

        double totalAvailable = 0.0;
        Map<String, Integer> perResource = new LinkedHashMap<>();
        for (Resource r : usable) {
            double hours = r.getHoursPerDay() * workingDays;
            if (constraints.getMaxHoursPerResource() != null) {
                hours = Math.min(hours, constraints.getMaxHoursPerResource());
            }
            totalAvailable += hours;
            perResource.put(r.getId(), averageHours > 0 ? (int) Math.floor(hours / averageHours) : 0);
        }

        int capacitySum = perResource.values().stream().mapToInt(Integer::intValue).sum();
        int possible = Math.min(capacitySum, processes.size());
        double required = averageHours * possible;
        double efficiency = totalAvailable > 0 ? Math.min(100.0, required / totalAvailable * 100.0) : 0.0;

        List<String> advice = recommendations.forCapacity(efficiency, perResource.values(), resources.size());
        LOGGER.info("Capacity estimate: {} possible processes, {} h available, efficiency {}%",
                possible, totalAvailable, String.format("%.1f", efficiency));
        return new CapacityReport(possible, Collections.unmodifiableMap(perResource), workingDays,
                totalAvailable, required, efficiency, advice);
    }

    private void validate(PlanningWindow window, List<Resource> resources, DistributionConstraints constraints) {
        if (window == null || window.getStart() == null || window.getEnd() == null
                || !window.getStart().isBefore(window.getEnd())) {
            throw new InvalidInputException(ErrorCode.INVALID_WINDOW, "Planning window start must be before end: " + window);
        }
        if (resources == null || resources.isEmpty()) {
            throw new InvalidInputException(ErrorCode.NO_RESOURCES, "At least one resource is required");
        }
        if (window.getStart().isBefore(LocalDate.now(clock))) {
            throw new InvalidInputException(ErrorCode.PAST_WINDOW, "Planning window starts in the past: " + window.getStart());
        }
        if (constraints != null) {
            constraints.validate();
        }
    }
}
