package com.iimsoft.planner.distribution;

import java.util.HashMap;
import java.util.Map;

/**
 * 资源占用台账：记录一次分配调用内每个资源已占用的工时和工作项数。
 * 只在单次调用内使用，不跨调用共享，也不回写 Resource。
 */
public class ResourceLedger {

    private final Map<String, Double> occupiedHours = new HashMap<>();
    private final Map<String, Integer> processCounts = new HashMap<>();

    public double occupiedHours(String resourceId) {
        return occupiedHours.getOrDefault(resourceId, 0.0);
    }

    public int processCount(String resourceId) {
        return processCounts.getOrDefault(resourceId, 0);
    }

    public void commit(String resourceId, double hours) {
        occupiedHours.merge(resourceId, hours, Double::sum);
        processCounts.merge(resourceId, 1, Integer::sum);
    }

    public double totalOccupiedHours() {
        double total = 0.0;
        for (double h : occupiedHours.values()) {
            total += h;
        }
        return total;
    }
}
