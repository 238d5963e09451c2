package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.Resource;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;

import java.util.List;

/**
 * 分配方案：资源为问题事实，工作项槽位为规划实体
 */
@PlanningSolution
public class AllocationPlan {

    @ProblemFactCollectionProperty
    @ValueRangeProvider(id = "resourceRange")
    private List<Resource> resourceList;

    @PlanningEntityCollectionProperty
    private List<ProcessSlot> slotList;

    @PlanningScore
    private HardSoftScore score;

    public AllocationPlan() {}

    public AllocationPlan(List<Resource> resourceList, List<ProcessSlot> slotList) {
        this.resourceList = resourceList;
        this.slotList = slotList;
    }

    public List<Resource> getResourceList() { return resourceList; }
    public void setResourceList(List<Resource> resourceList) { this.resourceList = resourceList; }
    public List<ProcessSlot> getSlotList() { return slotList; }
    public void setSlotList(List<ProcessSlot> slotList) { this.slotList = slotList; }
    public HardSoftScore getScore() { return score; }
    public void setScore(HardSoftScore score) { this.score = score; }
}
