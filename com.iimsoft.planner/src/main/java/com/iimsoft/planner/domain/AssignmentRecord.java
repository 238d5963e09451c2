package com.iimsoft.planner.domain;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * One entry of a resource's assign/release history.
 */
@Value
public class AssignmentRecord {

    public enum Action { ASSIGNED, RELEASED }

    String processId;
    double amount;
    Action action;
    LocalDateTime timestamp;
    double capacityBefore;
    double capacityAfter;
}
