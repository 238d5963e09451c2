package com.iimsoft.planner.optimization;

import com.iimsoft.planner.distribution.AssignmentTimeline;
import com.iimsoft.planner.distribution.ConstraintFilter;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.distribution.ResourceLedger;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 直接编码：genes[i] 为第 i 个工作项所分配资源的下标，-1 表示不分配。
 * 解码时按工作项顺序在资源上首尾相接排布；不可行的基因（容量不足、能力不符、资源不可用）直接丢弃，不做修复。
 */
public class SolutionDecoder {

    public static final int UNASSIGNED = -1;

    private final List<Process> processes;
    private final List<Resource> resources;
    private final ConstraintFilter filter;
    private final LocalDateTime baseStart;
    private final Map<String, Integer> processIndex = new HashMap<>();
    private final Map<String, Integer> resourceIndex = new HashMap<>();

    public SolutionDecoder(List<Process> processes, List<Resource> resources, ConstraintFilter filter, LocalDateTime baseStart) {
        this.processes = processes;
        this.resources = resources;
        this.filter = filter;
        this.baseStart = baseStart;
        for (int i = 0; i < processes.size(); i++) processIndex.put(processes.get(i).getId(), i);
        for (int j = 0; j < resources.size(); j++) resourceIndex.put(resources.get(j).getId(), j);
    }

    public List<Assignment> decode(int[] genes) {
        ResourceLedger ledger = new ResourceLedger();
        DistributionConstraints none = DistributionConstraints.none();
        List<Assignment> out = new ArrayList<>();
        for (int i = 0; i < genes.length; i++) {
            int r = genes[i];
            if (r < 0 || r >= resources.size()) {
                continue;
            }
            Process process = processes.get(i);
            Resource resource = resources.get(r);
            if (!filter.isFeasible(process, resource, ledger, none)) {
                continue;
            }
            LocalDateTime start = AssignmentTimeline.HOURS.start(baseStart, resource, ledger.occupiedHours(resource.getId()));
            LocalDateTime end = AssignmentTimeline.HOURS.end(start, resource, process.getEstimatedHours());
            out.add(Assignment.of(process, resource, start, end));
            ledger.commit(resource.getId(), process.getEstimatedHours());
        }
        return out;
    }

    public int[] encode(List<Assignment> assignments) {
        int[] genes = new int[processes.size()];
        Arrays.fill(genes, UNASSIGNED);
        for (Assignment a : assignments) {
            Integer p = processIndex.get(a.getProcessId());
            Integer r = resourceIndex.get(a.getResourceId());
            if (p != null && r != null) {
                genes[p] = r;
            }
        }
        return genes;
    }

    /**
     * Whether a single gene could stand on its own: resource open, enough raw headroom, capability match.
     */
    public boolean isPlaceable(int processIdx, int resourceIdx) {
        Process p = processes.get(processIdx);
        Resource r = resources.get(resourceIdx);
        return r.canAccept(p.getEstimatedHours()) && filter.isCompatible(p, r);
    }

    public int processCount() { return processes.size(); }
    public int resourceCount() { return resources.size(); }
}
