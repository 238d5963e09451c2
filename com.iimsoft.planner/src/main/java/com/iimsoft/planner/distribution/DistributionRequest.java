package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

@Getter
@Builder
public class DistributionRequest {

    @Builder.Default
    private final List<Process> processes = Collections.emptyList();
    @Builder.Default
    private final List<Resource> resources = Collections.emptyList();
    @Builder.Default
    private final DistributionStrategy strategy = DistributionStrategy.BALANCED;
    @Builder.Default
    private final DistributionConstraints constraints = DistributionConstraints.none();

    // null 时取时钟当前时间
    private final LocalDateTime baseStart;

    private final boolean optimizeCosts;
}
