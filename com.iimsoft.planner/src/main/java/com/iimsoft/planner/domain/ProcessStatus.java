package com.iimsoft.planner.domain;

public enum ProcessStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    PAUSED,
    CANCELLED,
    ERROR
}
