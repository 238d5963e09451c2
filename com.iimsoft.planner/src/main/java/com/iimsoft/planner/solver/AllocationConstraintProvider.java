package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.Resource;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;

/**
 * 约束提供者：定义分配方案的硬约束和软约束
 */
public class AllocationConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory constraintFactory) {
        return new Constraint[] {
            // 硬约束
            resourceCapacity(constraintFactory),
            capabilityMismatch(constraintFactory),
            unavailableResource(constraintFactory),

            // 软约束
            weightedCost(constraintFactory),
            freeCapacityReward(constraintFactory)
        };
    }

    // ========== 硬约束 ==========

    /**
     * 硬约束1：资源容量 - 分给同一资源的工时之和不能超过其剩余容量（按分钟计）
     */
    Constraint resourceCapacity(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProcessSlot.class)
                .groupBy(ProcessSlot::getResource, ConstraintCollectors.sum(ProcessSlot::getRequiredMinutes))
                .filter((resource, minutes) -> minutes > availableMinutes(resource))
                .penalize(HardSoftScore.ONE_HARD, (resource, minutes) -> minutes - availableMinutes(resource))
                .asConstraint("Resource capacity");
    }

    /**
     * 硬约束2：能力匹配 - 资源必须满足工作项任意一个能力需求
     */
    Constraint capabilityMismatch(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProcessSlot.class)
                .filter(slot -> !slot.isCompatible())
                .penalize(HardSoftScore.ONE_HARD)
                .asConstraint("Capability mismatch");
    }

    /**
     * 硬约束3：资源状态 - 只能使用可用的资源
     */
    Constraint unavailableResource(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProcessSlot.class)
                .filter(slot -> !slot.getResource().isAvailable())
                .penalize(HardSoftScore.ONE_HARD)
                .asConstraint("Unavailable resource");
    }

    // ========== 软约束 ==========

    Constraint weightedCost(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProcessSlot.class)
                .penalize(HardSoftScore.ONE_SOFT, ProcessSlot::getWeightedCost)
                .asConstraint("Weighted cost and time");
    }

    Constraint freeCapacityReward(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProcessSlot.class)
                .reward(HardSoftScore.ONE_SOFT, ProcessSlot::getEfficiencyReward)
                .asConstraint("Free capacity");
    }

    private static int availableMinutes(Resource resource) {
        return (int) Math.floor(resource.getAvailableCapacity() * 60.0);
    }
}
