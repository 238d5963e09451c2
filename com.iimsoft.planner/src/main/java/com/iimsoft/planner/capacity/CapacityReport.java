package com.iimsoft.planner.capacity;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class CapacityReport {
    int possibleProcessCount;
    // 资源 id -> 可容纳的工作项数
    Map<String, Integer> perResourceCapacity;
    int workingDays;
    double totalAvailableHours;
    double totalRequiredHours;
    double projectedEfficiency;
    List<String> recommendations;
}
