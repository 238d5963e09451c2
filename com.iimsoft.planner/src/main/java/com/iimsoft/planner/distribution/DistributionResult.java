package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.metrics.DistributionMetrics;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one distribution run. {@code assignments} and {@code unassigned} partition the input processes.
 */
@Value
public class DistributionResult {
    DistributionStrategy strategy;
    List<Assignment> assignments;
    List<Process> unassigned;
    DistributionMetrics metrics;
    List<String> recommendations;

    public int getAssignedCount() {
        return assignments.size();
    }

    public long getResourcesUsed() {
        return assignments.stream().map(Assignment::getResourceId).distinct().count();
    }
}
