package com.iimsoft.planner.domain;

/**
 * 资源状态：只有 AVAILABLE 且有剩余容量的资源可被分配
 */
public enum ResourceStatus {
    AVAILABLE,
    ASSIGNED,
    BUSY,
    MAINTENANCE,
    INACTIVE,
    RETIRED
}
