package com.iimsoft.planner.distribution;

import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Request-scoped restrictions of a capacity or distribution call. Every field is optional.
 */
@Getter
@Builder(toBuilder = true)
public class DistributionConstraints {

    private final Integer maxProcessesPerResource;
    private final Double maxHoursPerResource;

    @Builder.Default
    private final Set<String> mandatoryResourceIds = Collections.emptySet();
    @Builder.Default
    private final Set<String> forbiddenResourceIds = Collections.emptySet();

    // 优先处理的工作项 id
    @Builder.Default
    private final List<String> priorityProcessIds = Collections.emptyList();

    private final LocalDateTime deadline;

    public static DistributionConstraints none() {
        return builder().build();
    }

    public boolean isForbidden(String resourceId) {
        return forbiddenResourceIds != null && forbiddenResourceIds.contains(resourceId);
    }

    /**
     * A non-empty mandatory set is a closed list: only those resources may be used.
     */
    public boolean isAllowedByMandatory(String resourceId) {
        return mandatoryResourceIds == null || mandatoryResourceIds.isEmpty() || mandatoryResourceIds.contains(resourceId);
    }

    public boolean isPriorityProcess(String processId) {
        return priorityProcessIds != null && priorityProcessIds.contains(processId);
    }

    public void validate() {
        if (maxProcessesPerResource != null && maxProcessesPerResource <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_RESTRICTION,
                    "maxProcessesPerResource must be > 0: " + maxProcessesPerResource);
        }
        if (maxHoursPerResource != null && !(maxHoursPerResource > 0)) {
            throw new InvalidInputException(ErrorCode.INVALID_RESTRICTION,
                    "maxHoursPerResource must be > 0: " + maxHoursPerResource);
        }
    }
}
