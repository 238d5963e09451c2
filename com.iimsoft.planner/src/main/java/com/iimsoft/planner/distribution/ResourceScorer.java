package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;

/**
 * Suitability of a resource for a process. Higher is better.
 */
@FunctionalInterface
public interface ResourceScorer {

    double score(Process process, Resource resource, ResourceLedger ledger);
}
