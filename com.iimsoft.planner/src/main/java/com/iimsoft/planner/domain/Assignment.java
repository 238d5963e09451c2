package com.iimsoft.planner.domain;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 分配结果：一条 (工作项, 资源, 工时, 区间, 成本) 记录，在一次运行内不可变
 */
@Value
public class Assignment {
    String processId;
    String resourceId;
    double hoursAssigned;
    LocalDateTime startTime;
    LocalDateTime endTime;
    int priority;
    double estimatedCost;

    public static Assignment of(Process process, Resource resource, LocalDateTime start, LocalDateTime end) {
        double hours = process.getEstimatedHours();
        return new Assignment(process.getId(), resource.getId(), hours, start, end,
                process.getPriority().getValue(), hours * resource.getCostPerHour());
    }

    public double getSpanHours() {
        return Duration.between(startTime, endTime).toSeconds() / 3600.0;
    }
}
