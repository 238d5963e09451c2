package com.iimsoft.planner.distribution;

import java.util.Locale;

/**
 * 分配策略：决定工作项的处理顺序和资源打分的偏置
 */
public enum DistributionStrategy {
    PRIORITY,
    COST_MINIMUM,
    TIME_MINIMUM,
    EFFICIENCY,
    BALANCED;

    /**
     * Maps a raw label to a strategy, accepting {@code cost-minimum} style spellings.
     * Unknown or blank labels map to BALANCED.
     */
    public static DistributionStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BALANCED;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (DistributionStrategy s : values()) {
            if (s.name().equals(key)) {
                return s;
            }
        }
        return BALANCED;
    }
}
