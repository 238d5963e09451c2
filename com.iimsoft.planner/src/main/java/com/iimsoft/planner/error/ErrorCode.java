package com.iimsoft.planner.error;

/**
 * 输入校验错误分类：校验阶段抛出，整个调用失败，不返回部分结果
 */
public enum ErrorCode {
    INVALID_WINDOW,
    PAST_WINDOW,
    NO_RESOURCES,
    NO_PROCESSES,
    INVALID_RESTRICTION,
    INVALID_PROCESS_STATE,
    INVALID_PARAMETERS
}
