package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 贪心分配：按给定顺序逐个处理工作项，在可行资源中选分数最高者（同分取先出现者），
 * 然后在台账上记入占用工时。找不到资源的工作项进入未分配列表，本轮不再重试。
 */
public class GreedyAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreedyAllocator.class);

    private final ConstraintFilter filter;
    private final AssignmentTimeline timeline;

    public GreedyAllocator(ConstraintFilter filter, AssignmentTimeline timeline) {
        this.filter = filter;
        this.timeline = timeline;
    }

    public AllocationOutcome allocate(List<Process> orderedProcesses,
                                      List<Resource> resources,
                                      ResourceScorer scorer,
                                      DistributionConstraints constraints,
                                      LocalDateTime baseStart) {
        ResourceLedger ledger = new ResourceLedger();
        List<Assignment> assignments = new ArrayList<>();
        List<Process> unassigned = new ArrayList<>();

        for (Process process : orderedProcesses) {
            Resource best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Resource resource : resources) {
                if (!filter.isFeasible(process, resource, ledger, constraints)) {
                    continue;
                }
                if (!meetsDeadline(process, resource, ledger, constraints, baseStart)) {
                    continue;
                }
                double s = scorer.score(process, resource, ledger);
                // 严格大于：同分保留先出现的资源
                if (best == null || s > bestScore) {
                    best = resource;
                    bestScore = s;
                }
            }

            if (best == null) {
                LOGGER.debug("No feasible resource for process {}", process.getName());
                unassigned.add(process);
                continue;
            }

            LocalDateTime start = timeline.start(baseStart, best, ledger.occupiedHours(best.getId()));
            LocalDateTime end = timeline.end(start, best, process.getEstimatedHours());
            assignments.add(Assignment.of(process, best, start, end));
            ledger.commit(best.getId(), process.getEstimatedHours());
            LOGGER.debug("Process {} -> resource {} (score {})", process.getName(), best.getName(), bestScore);
        }
        return new AllocationOutcome(Collections.unmodifiableList(assignments), Collections.unmodifiableList(unassigned), ledger);
    }

    private boolean meetsDeadline(Process process, Resource resource, ResourceLedger ledger,
                                  DistributionConstraints constraints, LocalDateTime baseStart) {
        if (constraints.getDeadline() == null) {
            return true;
        }
        LocalDateTime start = timeline.start(baseStart, resource, ledger.occupiedHours(resource.getId()));
        LocalDateTime end = timeline.end(start, resource, process.getEstimatedHours());
        return !end.isAfter(constraints.getDeadline());
    }
}
