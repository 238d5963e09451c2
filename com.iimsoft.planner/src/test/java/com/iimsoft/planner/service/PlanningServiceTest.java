package com.iimsoft.planner.service;

import com.iimsoft.planner.TestData;
import com.iimsoft.planner.capacity.CapacityReport;
import com.iimsoft.planner.capacity.PlanningWindow;
import com.iimsoft.planner.capacity.ProcessCatalog;
import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.distribution.DistributionResult;
import com.iimsoft.planner.distribution.DistributionStrategy;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.optimization.OptimizationAlgorithm;
import com.iimsoft.planner.optimization.OptimizationParameters;
import com.iimsoft.planner.optimization.OptimizationResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.iimsoft.planner.TestData.process;
import static com.iimsoft.planner.TestData.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlanningServiceTest {

    private final List<Resource> resources = List.of(resource("R1", 40, 10, "java"), resource("R2", 40, 30, "sql"));
    private final List<Process> processes = List.of(process("P1", 8, "java"), process("P2", 4, "sql"), process("P3", 2));

    @Test
    void facade_runsAllThreeOperations() {
        ProcessCatalog catalog = mock(ProcessCatalog.class);
        when(catalog.findActive()).thenReturn(processes);
        PlanningService service = new PlanningService(PlannerSettings.defaults(), TestData.CLOCK, catalog);
        LocalDate monday = LocalDate.of(2026, 1, 5);

        CapacityReport capacity = service.computeCapacity(PlanningWindow.of(monday, monday.plusWeeks(2)), resources, null);
        assertThat(capacity.getWorkingDays()).isEqualTo(10);
        assertThat(capacity.getPossibleProcessCount()).isEqualTo(3);

        DistributionResult distribution = service.distribute(processes, resources, DistributionStrategy.COST_MINIMUM, null);
        assertThat(distribution.getAssignedCount()).isEqualTo(3);
        assertThat(distribution.getUnassigned()).isEmpty();

        OptimizationResult optimization = service.optimize(processes, resources,
                OptimizationParameters.of(OptimizationAlgorithm.GREEDY));
        assertThat(optimization.getAssignments()).hasSize(3);
    }

    @Test
    void recommendationThresholds_followSettings() {
        PlannerSettings settings = PlannerSettings.defaults();
        settings.getRecommendations().minResourceCount = 1;
        PlanningService service = new PlanningService(settings, TestData.CLOCK);
        LocalDate monday = LocalDate.of(2026, 1, 5);

        CapacityReport capacity = service.computeCapacity(PlanningWindow.of(monday, monday.plusWeeks(1)),
                resources, processes, null);

        assertThat(capacity.getRecommendations()).doesNotContain("Consider diversifying resources to reduce risk");
    }
}
