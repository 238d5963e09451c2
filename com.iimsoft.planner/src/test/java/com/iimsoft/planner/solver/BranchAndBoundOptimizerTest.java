package com.iimsoft.planner.solver;

import com.iimsoft.planner.TestData;
import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.optimization.OptimizationAlgorithm;
import com.iimsoft.planner.optimization.OptimizationParameters;
import com.iimsoft.planner.optimization.OptimizationResult;
import com.iimsoft.planner.optimization.ResourceOptimizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.iimsoft.planner.TestData.process;
import static com.iimsoft.planner.TestData.resource;
import static org.assertj.core.api.Assertions.assertThat;

class BranchAndBoundOptimizerTest {

    private final List<Resource> resources = List.of(resource("R1", 40, 10, "java"), resource("R2", 40, 20, "python"));

    @Test
    void smallInstance_isSolvedExactly() {
        List<Process> processes = List.of(process("P1", 4, "python"), process("P2", 6), process("P3", 8));
        ResourceOptimizer optimizer = new ResourceOptimizer(PlannerSettings.defaults(), TestData.CLOCK);

        OptimizationResult result = optimizer.optimize(processes, resources,
                OptimizationParameters.of(OptimizationAlgorithm.BRANCH_AND_BOUND));

        assertThat(result.getAlgorithmUsed()).isEqualTo(OptimizationAlgorithm.BRANCH_AND_BOUND);
        assertThat(result.getAssignments()).hasSize(3);
        assertThat(result.getAssignments())
                .filteredOn(a -> a.getProcessId().equals("P1"))
                .singleElement()
                .extracting(Assignment::getResourceId).isEqualTo("R2");
        assertThat(result.getAssignments())
                .filteredOn(a -> !a.getProcessId().equals("P1"))
                .extracting(Assignment::getResourceId)
                .containsOnly("R1");
        assertThat(result.getDetails()).containsKey("score");
        assertThat(result.getIterations()).isPositive();
    }

    @Test
    void tooManyProcesses_fallsBackToGreedy() {
        List<Process> processes = new ArrayList<>();
        for (int i = 0; i < 13; i++) {
            processes.add(process("P" + i, 1));
        }
        ResourceOptimizer optimizer = new ResourceOptimizer(PlannerSettings.defaults(), TestData.CLOCK);

        OptimizationResult result = optimizer.optimize(processes, resources,
                OptimizationParameters.of(OptimizationAlgorithm.BRANCH_AND_BOUND));

        assertThat(result.getAlgorithmUsed()).isEqualTo(OptimizationAlgorithm.GREEDY);
        assertThat(result.getDetails()).containsEntry(OptimizationResult.FALLBACK_FROM, "BRANCH_AND_BOUND");
        assertThat(result.getAssignments()).hasSize(13);
    }

    @Test
    void processLimit_comesFromSettings() {
        PlannerSettings settings = PlannerSettings.defaults();
        settings.getBranchAndBound().maxProcesses = 1;
        ResourceOptimizer optimizer = new ResourceOptimizer(settings, TestData.CLOCK);

        OptimizationResult result = optimizer.optimize(List.of(process("P1", 1), process("P2", 1)), resources,
                OptimizationParameters.of(OptimizationAlgorithm.BRANCH_AND_BOUND));

        assertThat(result.getAlgorithmUsed()).isEqualTo(OptimizationAlgorithm.GREEDY);
    }

    @Test
    void buildProblem_createsOneSlotPerProcess() {
        List<Process> processes = List.of(process("P1", 1.5), process("P2", 2));

        AllocationPlan plan = BranchAndBoundOptimizer.buildProblem(processes, resources, new OptimizationParameters());

        assertThat(plan.getSlotList()).extracting(ProcessSlot::getId).containsExactly(0L, 1L);
        assertThat(plan.getSlotList()).allSatisfy(s -> assertThat(s.getResource()).isNull());
        assertThat(plan.getSlotList().get(0).getRequiredMinutes()).isEqualTo(90);
        assertThat(plan.getResourceList()).containsExactlyElementsOf(resources);
    }
}
