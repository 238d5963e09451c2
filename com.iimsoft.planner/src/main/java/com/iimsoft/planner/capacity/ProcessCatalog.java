package com.iimsoft.planner.capacity;

import com.iimsoft.planner.domain.Process;

import java.util.List;

/**
 * 工作项来源：由外部存储实现，返回当前活跃的工作项
 */
public interface ProcessCatalog {

    List<Process> findActive();
}
