package com.iimsoft.planner.domain;

/**
 * 工作项类型
 */
public enum ProcessType {
    /** 常规 */
    ROUTINE,
    /** 特殊 */
    SPECIAL,
    /** 紧急 */
    URGENT,
    /** 维护 */
    MAINTENANCE
}
