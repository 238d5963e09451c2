package com.iimsoft.planner.optimization;

import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.distribution.ConstraintFilter;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;

/**
 * Everything one optimization call works with. Built fresh per call: the random generator,
 * the decoder and every ledger derived from it are never shared between calls.
 */
@Getter
public class OptimizationContext {

    private final List<Process> processes;
    private final List<Resource> resources;
    private final OptimizationParameters parameters;
    private final PlannerSettings settings;
    private final Random random;
    private final LocalDateTime baseStart;
    private final OptimizationMonitor monitor;
    private final ConstraintFilter filter;
    private final SolutionDecoder decoder;
    private final ObjectiveFunction objective;

    public OptimizationContext(List<Process> processes, List<Resource> resources, OptimizationParameters parameters,
                               PlannerSettings settings, LocalDateTime baseStart, OptimizationMonitor monitor) {
        this.processes = List.copyOf(processes);
        this.resources = List.copyOf(resources);
        this.parameters = parameters;
        this.settings = settings;
        this.random = parameters.randomSeed != null ? new Random(parameters.randomSeed) : new Random();
        this.baseStart = baseStart;
        this.monitor = monitor == null ? OptimizationMonitor.NONE : monitor;
        this.filter = new ConstraintFilter();
        this.decoder = new SolutionDecoder(this.processes, this.resources, filter, baseStart);
        this.objective = ObjectiveFunction.of(parameters);
    }
}
