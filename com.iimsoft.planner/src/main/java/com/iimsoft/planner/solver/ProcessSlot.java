package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

/**
 * 规划实体：一个待分配的工作项。
 * 规划变量：resource（Resource 类型），穷举搜索要求每个工作项都必须分到资源。
 */
@PlanningEntity
public class ProcessSlot {

    // 软分数放大倍数，保留两位小数精度
    static final int SOFT_SCALE = 100;

    @PlanningId
    private Long id;

    private Process process;
    private double weightCost;
    private double weightTime;
    private double weightEfficiency;

    // 规划变量
    @PlanningVariable(valueRangeProviderRefs = "resourceRange")
    private Resource resource;

    public ProcessSlot() {}

    public ProcessSlot(Long id, Process process, double weightCost, double weightTime, double weightEfficiency) {
        this.id = id;
        this.process = process;
        this.weightCost = weightCost;
        this.weightTime = weightTime;
        this.weightEfficiency = weightEfficiency;
    }

    public Long getId() { return id; }
    public Process getProcess() { return process; }
    public Resource getResource() { return resource; }
    public void setResource(Resource resource) { this.resource = resource; }

    public int getRequiredMinutes() {
        return (int) Math.ceil(process.getEstimatedHours() * 60.0);
    }

    /** match-any，未声明能力需求的工作项可以分给任意资源 */
    public boolean isCompatible() {
        if (resource == null || process.getRequiredCapabilities().isEmpty()) {
            return true;
        }
        for (String tag : process.getRequiredCapabilities()) {
            if (resource.matches(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Weighted cost and hours of running the process on the current resource, scaled to an integer.
     */
    public int getWeightedCost() {
        double hours = process.getEstimatedHours();
        return (int) Math.round(SOFT_SCALE * (weightCost * hours * resource.getCostPerHour() + weightTime * hours));
    }

    /**
     * Weighted share of the current resource's capacity still free, scaled to an integer.
     */
    public int getEfficiencyReward() {
        return (int) Math.round(SOFT_SCALE * weightEfficiency * resource.getAvailableCapacity() / resource.getMaxCapacity());
    }

    @Override
    public String toString() {
        return "ProcessSlot{" + process.getName() + " -> " + (resource == null ? "-" : resource.getName()) + "}";
    }
}
