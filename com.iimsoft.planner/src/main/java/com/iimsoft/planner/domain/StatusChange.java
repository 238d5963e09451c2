package com.iimsoft.planner.domain;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class StatusChange {
    LocalDateTime timestamp;
    ResourceStatus from;
    ResourceStatus to;
    String reason;
}
