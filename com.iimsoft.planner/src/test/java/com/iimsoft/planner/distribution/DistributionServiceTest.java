package com.iimsoft.planner.distribution;

import com.iimsoft.planner.TestData;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.ExperienceLevel;
import com.iimsoft.planner.domain.Priority;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.AllocationFailedException;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.iimsoft.planner.TestData.NOW;
import static com.iimsoft.planner.TestData.process;
import static com.iimsoft.planner.TestData.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DistributionServiceTest {

    private final DistributionService service = new DistributionService(TestData.CLOCK);

    private DistributionResult run(List<Process> processes, List<Resource> resources,
                                   DistributionStrategy strategy, DistributionConstraints constraints) {
        return service.distribute(DistributionRequest.builder()
                .processes(processes)
                .resources(resources)
                .strategy(strategy)
                .constraints(constraints)
                .build());
    }

    private DistributionResult run(List<Process> processes, List<Resource> resources) {
        return run(processes, resources, DistributionStrategy.BALANCED, DistributionConstraints.none());
    }

    @Test
    void singleProcess_singleResource() {
        DistributionResult result = run(List.of(process("P1", 8)), List.of(resource("R1", 40, 10)));

        assertThat(result.getAssignments()).singleElement().satisfies(a -> {
            assertThat(a.getProcessId()).isEqualTo("P1");
            assertThat(a.getResourceId()).isEqualTo("R1");
            assertThat(a.getHoursAssigned()).isEqualTo(8.0);
            assertThat(a.getEstimatedCost()).isEqualTo(80.0);
            assertThat(a.getStartTime()).isEqualTo(NOW);
            // ceil(8 / 8) + 1 days
            assertThat(a.getEndTime()).isEqualTo(NOW.plusDays(2));
        });
        assertThat(result.getUnassigned()).isEmpty();
        assertThat(result.getMetrics().getTotalCost()).isEqualTo(80.0);
        assertThat(result.getAssignedCount()).isEqualTo(1);
    }

    @Test
    void queuedWork_pushesStartByWholeDays() {
        DistributionResult result = run(List.of(process("P1", 8), process("P2", 4)), List.of(resource("R1", 40, 10)));

        Assignment second = result.getAssignments().get(1);
        assertThat(second.getStartTime()).isEqualTo(NOW.plusDays(1));
        assertThat(second.getEndTime()).isEqualTo(NOW.plusDays(3));
    }

    @Test
    void capabilityMatch_routesToCapableResource() {
        List<Resource> resources = List.of(resource("R1", 40, 10, "python"), resource("R2", 40, 10));
        List<Process> processes = List.of(process("P1", 8, "python"), process("P2", 8, "python"));

        DistributionResult result = run(processes, resources);

        assertThat(result.getAssignments()).extracting(Assignment::getResourceId).containsExactly("R1", "R1");
    }

    @Test
    void capabilityMatch_capacityLeavesRestUnassigned() {
        List<Resource> resources = List.of(resource("R1", 10, 10, "python"), resource("R2", 40, 10));
        List<Process> processes = List.of(process("P1", 8, "python"), process("P2", 8, "python"));

        DistributionResult result = run(processes, resources);

        assertThat(result.getAssignments()).extracting(Assignment::getProcessId).containsExactly("P1");
        assertThat(result.getUnassigned()).extracting(Process::getId).containsExactly("P2");
        assertThat(result.getRecommendations())
                .contains("There are 1 unassigned processes. Consider adding resources or relaxing restrictions");
    }

    @Test
    void maxHoursPerResource_blocksOversizedProcess() {
        DistributionConstraints c = DistributionConstraints.builder().maxHoursPerResource(5.0).build();

        DistributionResult result = run(List.of(process("P1", 8)), List.of(resource("R1", 40, 10)),
                DistributionStrategy.BALANCED, c);

        assertThat(result.getAssignments()).isEmpty();
        assertThat(result.getUnassigned()).extracting(Process::getId).containsExactly("P1");
        assertThat(result.getMetrics().getEfficiency()).isZero();
    }

    @Test
    void tie_goesToFirstResource() {
        Resource r1 = resource("R1", 40, 10);
        Resource r2 = resource("R2", 40, 10);

        assertThat(run(List.of(process("P1", 4)), List.of(r1, r2)).getAssignments().get(0).getResourceId()).isEqualTo("R1");
        assertThat(run(List.of(process("P1", 4)), List.of(r2, r1)).getAssignments().get(0).getResourceId()).isEqualTo("R2");
    }

    @Test
    void maxProcessesPerResource_spreadsLoad() {
        DistributionConstraints c = DistributionConstraints.builder().maxProcessesPerResource(1).build();
        List<Process> processes = List.of(process("P1", 2), process("P2", 2), process("P3", 2));

        DistributionResult result = run(processes, List.of(resource("R1", 40, 10), resource("R2", 40, 10)),
                DistributionStrategy.BALANCED, c);

        assertThat(result.getAssignments()).extracting(Assignment::getResourceId).containsExactly("R1", "R2");
        assertThat(result.getUnassigned()).extracting(Process::getId).containsExactly("P3");
    }

    @Test
    void deadline_rejectsLateIntervals() {
        DistributionConstraints tight = DistributionConstraints.builder().deadline(NOW.plusDays(1)).build();
        DistributionConstraints loose = DistributionConstraints.builder().deadline(NOW.plusDays(2)).build();

        assertThat(run(List.of(process("P1", 8)), List.of(resource("R1", 40, 10)), DistributionStrategy.BALANCED, tight)
                .getAssignments()).isEmpty();
        assertThat(run(List.of(process("P1", 8)), List.of(resource("R1", 40, 10)), DistributionStrategy.BALANCED, loose)
                .getAssignments()).hasSize(1);
    }

    @Test
    void priorityStrategy_sendsHighPriorityToExperiencedResource() {
        Resource junior = resource("R1", 40, 10);
        junior.setExperience(ExperienceLevel.JUNIOR);
        Resource senior = resource("R2", 40, 50);
        senior.setExperience(ExperienceLevel.EXPERT);

        DistributionResult result = run(List.of(process("P1", 4, Priority.CRITICAL)), List.of(junior, senior),
                DistributionStrategy.PRIORITY, DistributionConstraints.none());

        assertThat(result.getAssignments().get(0).getResourceId()).isEqualTo("R2");
    }

    @Test
    void costMinimum_picksCheapestResource() {
        DistributionResult result = run(List.of(process("P1", 4)), List.of(resource("R1", 40, 50), resource("R2", 40, 20)),
                DistributionStrategy.COST_MINIMUM, DistributionConstraints.none());

        assertThat(result.getAssignments().get(0).getResourceId()).isEqualTo("R2");
        assertThat(result.getMetrics().getTotalCost()).isEqualTo(80.0);
    }

    @Test
    void efficiency_picksResourceWithMostFreeCapacity() {
        DistributionResult result = run(List.of(process("P1", 4)),
                List.of(resource("R1", 40, 30, 10), resource("R2", 40, 10)),
                DistributionStrategy.EFFICIENCY, DistributionConstraints.none());

        assertThat(result.getAssignments().get(0).getResourceId()).isEqualTo("R2");
    }

    @Test
    void balanced_prefersBusierResource() {
        DistributionResult result = run(List.of(process("P1", 4)),
                List.of(resource("R1", 40, 10), resource("R2", 40, 20, 10)),
                DistributionStrategy.BALANCED, DistributionConstraints.none());

        assertThat(result.getAssignments().get(0).getResourceId()).isEqualTo("R2");
    }

    @ParameterizedTest
    @EnumSource(DistributionStrategy.class)
    void everyStrategy_partitionsInputAndConservesCapacity(DistributionStrategy strategy) {
        List<Resource> resources = List.of(
                resource("R1", 20, 15, "java"),
                resource("R2", 16, 4, 25, "sql"),
                resource("R3", 30, 40, "java", "testing"));
        List<Process> processes = new ArrayList<>();
        Priority[] priorities = Priority.values();
        String[] tags = {"java", "sql", "testing", "cobol"};
        for (int i = 0; i < 12; i++) {
            processes.add(process("P" + i, 2 + (i % 5) * 1.5, priorities[i % priorities.length], tags[i % tags.length]));
        }

        DistributionResult result = run(processes, resources, strategy, DistributionConstraints.none());

        List<String> seen = Stream.concat(
                result.getAssignments().stream().map(Assignment::getProcessId),
                result.getUnassigned().stream().map(Process::getId)).collect(Collectors.toList());
        assertThat(seen).doesNotHaveDuplicates()
                .containsExactlyInAnyOrderElementsOf(processes.stream().map(Process::getId).collect(Collectors.toList()));

        Map<String, Double> hours = new HashMap<>();
        for (Assignment a : result.getAssignments()) {
            hours.merge(a.getResourceId(), a.getHoursAssigned(), Double::sum);
        }
        for (Resource r : resources) {
            assertThat(hours.getOrDefault(r.getId(), 0.0)).isLessThanOrEqualTo(r.getAvailableCapacity());
        }
        // cobol 没有任何资源能做
        assertThat(result.getUnassigned()).extracting(Process::getId).contains("P3", "P7", "P11");
    }

    @Test
    void distribute_doesNotMutateResources() {
        Resource r = resource("R1", 40, 10);
        run(List.of(process("P1", 8), process("P2", 8)), List.of(r));

        assertThat(r.getCurrentCapacity()).isZero();
        assertThat(r.getAssignedProcessIds()).isEmpty();
    }

    @Test
    void explicitBaseStart_isUsed() {
        DistributionResult result = service.distribute(DistributionRequest.builder()
                .processes(List.of(process("P1", 4)))
                .resources(List.of(resource("R1", 40, 10)))
                .baseStart(NOW.plusWeeks(1))
                .build());

        assertThat(result.getAssignments().get(0).getStartTime()).isEqualTo(NOW.plusWeeks(1));
        assertThat(result.getStrategy()).isEqualTo(DistributionStrategy.BALANCED);
    }

    @Test
    void emptyInputs_areRejected() {
        assertThatThrownBy(() -> run(List.of(), List.of(resource("R1", 40, 10))))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NO_PROCESSES));
        assertThatThrownBy(() -> run(List.of(process("P1", 1)), List.of()))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NO_RESOURCES));
    }

    @Test
    void nonPendingProcess_isRejected() {
        Process done = process("P1", 1);
        done.cancel("dropped", NOW);

        assertThatThrownBy(() -> run(List.of(done), List.of(resource("R1", 40, 10))))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_PROCESS_STATE));
    }

    @Test
    void unexpectedFailure_isWrapped() {
        Resource broken = mock(Resource.class);
        when(broken.getId()).thenReturn("X");
        when(broken.isAvailable()).thenReturn(true);
        when(broken.getAvailableCapacity()).thenReturn(100.0);
        when(broken.getUtilizationPercent()).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> run(List.of(process("P1", 1)), List.of(broken)))
                .isInstanceOf(AllocationFailedException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
