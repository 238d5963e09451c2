package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.ProcessStatus;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 约束过滤：
 * - 按状态、禁用/指定名单筛选可用资源
 * - 按优先名单和策略对工作项排序
 * - 单个 (工作项, 资源) 组合的可行性检查
 */
public class ConstraintFilter {

    /**
     * Fails when a restriction is out of range or any process is not PENDING.
     */
    public void validate(List<Process> processes, DistributionConstraints constraints) {
        constraints.validate();
        for (Process p : processes) {
            if (p.getStatus() != ProcessStatus.PENDING) {
                throw new InvalidInputException(ErrorCode.INVALID_PROCESS_STATE,
                        "Process " + p.getName() + " is " + p.getStatus() + ", only PENDING processes can be distributed");
            }
        }
    }

    public List<Resource> filterResources(List<Resource> resources, DistributionConstraints constraints) {
        List<Resource> eligible = new ArrayList<>();
        for (Resource r : resources) {
            if (!r.isAvailable()) {
                continue;
            }
            if (constraints.isForbidden(r.getId()) || !constraints.isAllowedByMandatory(r.getId())) {
                continue;
            }
            eligible.add(r);
        }
        return eligible;
    }

    /**
     * Priority-listed processes first, then the rest. Each group keeps the input order
     * and is then stably sorted by the strategy key.
     */
    public List<Process> orderProcesses(List<Process> processes, List<Resource> resources,
                                        DistributionStrategy strategy, DistributionConstraints constraints) {
        List<Process> first = new ArrayList<>();
        List<Process> rest = new ArrayList<>();
        for (Process p : processes) {
            if (constraints.isPriorityProcess(p.getId())) {
                first.add(p);
            } else {
                rest.add(p);
            }
        }
        Comparator<Process> order = strategyOrder(strategy, resources);
        if (order != null) {
            first.sort(order);
            rest.sort(order);
        }
        List<Process> ordered = new ArrayList<>(processes.size());
        ordered.addAll(first);
        ordered.addAll(rest);
        return ordered;
    }

    private Comparator<Process> strategyOrder(DistributionStrategy strategy, List<Resource> resources) {
        switch (strategy) {
            case PRIORITY:
                return Comparator.comparingInt((Process p) -> p.getPriority().getValue()).reversed();
            case TIME_MINIMUM:
                return Comparator.comparingDouble(Process::getEstimatedHours);
            case COST_MINIMUM:
                return Comparator.comparingDouble(p -> estimatedCost(p, resources));
            case EFFICIENCY:
                return Comparator.comparingDouble(p -> p.getEstimatedHours() / Math.max(1, p.getRequiredCapabilities().size()));
            default:
                return null;
        }
    }

    /**
     * Rough cost of a process: hours at the cheapest paid resource, or, per required tag,
     * hours at the cheapest resource matching that tag.
     */
    public double estimatedCost(Process process, List<Resource> resources) {
        double hours = process.getEstimatedHours();
        if (process.getRequiredCapabilities().isEmpty()) {
            double cheapest = resources.stream()
                    .mapToDouble(Resource::getCostPerHour)
                    .filter(c -> c > 0)
                    .min()
                    .orElse(0.0);
            return hours * cheapest;
        }
        double total = 0.0;
        for (String tag : process.getRequiredCapabilities()) {
            double cheapest = resources.stream()
                    .filter(r -> r.matches(tag))
                    .mapToDouble(Resource::getCostPerHour)
                    .min()
                    .orElse(0.0);
            total += hours * cheapest;
        }
        return total;
    }

    /**
     * Capacity, per-resource caps and capability match, given what this run already placed on the resource.
     */
    public boolean isFeasible(Process process, Resource resource, ResourceLedger ledger, DistributionConstraints constraints) {
        double hours = process.getEstimatedHours();
        double occupied = ledger.occupiedHours(resource.getId());
        if (constraints.getMaxHoursPerResource() != null && occupied + hours > constraints.getMaxHoursPerResource()) {
            return false;
        }
        if (constraints.getMaxProcessesPerResource() != null
                && ledger.processCount(resource.getId()) >= constraints.getMaxProcessesPerResource()) {
            return false;
        }
        if (!resource.isAvailable() || occupied + hours > resource.getAvailableCapacity()) {
            return false;
        }
        return isCompatible(process, resource);
    }

    /** match-any */
    public boolean isCompatible(Process process, Resource resource) {
        if (process.getRequiredCapabilities().isEmpty()) {
            return true;
        }
        for (String tag : process.getRequiredCapabilities()) {
            if (resource.matches(tag)) {
                return true;
            }
        }
        return false;
    }
}
