package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;

/**
 * 资源打分（越大越好）：
 * - 基础分 = 利用率 × 0.1
 * - 每个满足的能力需求 +10
 * - 策略偏置：COST_MINIMUM 偏向便宜资源，EFFICIENCY 偏向剩余容量大的资源，
 *   PRIORITY 为高优先级工作项偏向资深资源
 */
public class ScoringModel {

    static final double UTILIZATION_WEIGHT = 0.1;
    static final double CAPABILITY_MATCH_BONUS = 10.0;
    static final double COST_CEILING = 100.0;
    static final double EXPERIENCE_BONUS = 50.0;
    static final int HIGH_PRIORITY_THRESHOLD = 8;

    public double score(Process process, Resource resource, DistributionStrategy strategy) {
        double score = resource.getUtilizationPercent() * UTILIZATION_WEIGHT;

        for (String tag : process.getRequiredCapabilities()) {
            if (resource.matches(tag)) {
                score += CAPABILITY_MATCH_BONUS;
            }
        }

        switch (strategy) {
            case COST_MINIMUM:
                score += Math.max(0.0, COST_CEILING - resource.getCostPerHour());
                break;
            case EFFICIENCY:
                score += resource.getAvailableCapacity();
                break;
            case PRIORITY:
                if (process.getPriority().getValue() >= HIGH_PRIORITY_THRESHOLD && resource.isExperienced()) {
                    score += EXPERIENCE_BONUS;
                }
                break;
            default:
                break;
        }
        return score;
    }

    public ResourceScorer scorerFor(DistributionStrategy strategy) {
        return (process, resource, ledger) -> score(process, resource, strategy);
    }
}
