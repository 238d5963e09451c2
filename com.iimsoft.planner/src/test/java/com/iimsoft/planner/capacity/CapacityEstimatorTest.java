package com.iimsoft.planner.capacity;

import com.iimsoft.planner.TestData;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.error.AllocationFailedException;
import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import com.iimsoft.planner.metrics.RecommendationGenerator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.iimsoft.planner.TestData.process;
import static com.iimsoft.planner.TestData.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapacityEstimatorTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 1, 5);
    private static final PlanningWindow ONE_WEEK = PlanningWindow.of(MONDAY, MONDAY.plusWeeks(1));

    private final CapacityEstimator estimator =
            new CapacityEstimator(null, new RecommendationGenerator(), TestData.CLOCK);

    private final List<Process> sample = List.of(process("P1", 4), process("P2", 6), process("P3", 8));

    @Test
    void estimate_oneWeekTwoResources() {
        List<Resource> resources = List.of(resource("R1", 100, 10), resource("R2", 100, 20));

        CapacityReport report = estimator.estimate(ONE_WEEK, resources, sample, DistributionConstraints.none());

        assertThat(report.getWorkingDays()).isEqualTo(5);
        assertThat(report.getTotalAvailableHours()).isEqualTo(80.0);
        // 40h / avg 6h
        assertThat(report.getPerResourceCapacity()).containsEntry("R1", 6).containsEntry("R2", 6);
        assertThat(report.getPossibleProcessCount()).isEqualTo(3);
        assertThat(report.getTotalRequiredHours()).isCloseTo(18.0, within(1e-9));
        assertThat(report.getProjectedEfficiency()).isCloseTo(22.5, within(1e-9));
        assertThat(report.getRecommendations()).containsExactly(
                "Consider adding more resources or extending the planning period",
                "Consider diversifying resources to reduce risk");
    }

    @Test
    void emptyWindow_isRejected() {
        PlanningWindow empty = PlanningWindow.of(MONDAY.plusDays(7), MONDAY.plusDays(7));
        assertThatThrownBy(() -> estimator.estimate(empty, List.of(resource("R1", 40, 10)), sample, null))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_WINDOW));
    }

    @Test
    void pastWindow_isRejected() {
        PlanningWindow past = PlanningWindow.of(MONDAY.minusDays(1), MONDAY.plusDays(3));
        assertThatThrownBy(() -> estimator.estimate(past, List.of(resource("R1", 40, 10)), sample, null))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.PAST_WINDOW));
    }

    @Test
    void noResources_isRejected() {
        assertThatThrownBy(() -> estimator.estimate(ONE_WEEK, Collections.emptyList(), sample, null))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NO_RESOURCES));
    }

    @Test
    void invalidRestriction_isRejected() {
        DistributionConstraints bad = DistributionConstraints.builder().maxHoursPerResource(0.0).build();
        assertThatThrownBy(() -> estimator.estimate(ONE_WEEK, List.of(resource("R1", 40, 10)), sample, bad))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_RESTRICTION));
    }

    @Test
    void addingResource_neverLowersCapacity() {
        List<Resource> two = List.of(resource("R1", 100, 10), resource("R2", 100, 20));
        List<Resource> three = List.of(resource("R1", 100, 10), resource("R2", 100, 20), resource("R3", 100, 30));

        CapacityReport before = estimator.estimate(ONE_WEEK, two, sample, null);
        CapacityReport after = estimator.estimate(ONE_WEEK, three, sample, null);

        assertThat(after.getPossibleProcessCount()).isGreaterThanOrEqualTo(before.getPossibleProcessCount());
        assertThat(after.getTotalAvailableHours()).isGreaterThan(before.getTotalAvailableHours());
        assertThat(after.getProjectedEfficiency()).isLessThanOrEqualTo(before.getProjectedEfficiency());
    }

    @Test
    void maxHoursPerResource_capsAvailableHours() {
        DistributionConstraints capped = DistributionConstraints.builder().maxHoursPerResource(10.0).build();
        List<Resource> resources = List.of(resource("R1", 100, 10), resource("R2", 100, 20));

        CapacityReport report = estimator.estimate(ONE_WEEK, resources, sample, capped);

        assertThat(report.getTotalAvailableHours()).isEqualTo(20.0);
        assertThat(report.getPerResourceCapacity()).containsEntry("R1", 1).containsEntry("R2", 1);
        assertThat(report.getPossibleProcessCount()).isEqualTo(2);
    }

    @Test
    void forbiddenAndMandatory_narrowTheResourceSet() {
        List<Resource> resources = List.of(resource("R1", 100, 10), resource("R2", 100, 20), resource("R3", 100, 30));
        DistributionConstraints c = DistributionConstraints.builder()
                .mandatoryResourceIds(Set.of("R1", "R2"))
                .forbiddenResourceIds(Set.of("R2"))
                .build();

        CapacityReport report = estimator.estimate(ONE_WEEK, resources, sample, c);

        assertThat(report.getPerResourceCapacity()).containsOnlyKeys("R1");
        assertThat(report.getTotalAvailableHours()).isEqualTo(40.0);
        // 资源数量建议按调用方提供的资源计，不按过滤后的
        assertThat(report.getRecommendations()).doesNotContain("Consider diversifying resources to reduce risk");
    }

    @Test
    void noProcesses_givesZeroCapacity() {
        CapacityReport report = estimator.estimate(ONE_WEEK, List.of(resource("R1", 100, 10)), Collections.emptyList(), null);

        assertThat(report.getPossibleProcessCount()).isZero();
        assertThat(report.getPerResourceCapacity()).containsEntry("R1", 0);
        assertThat(report.getProjectedEfficiency()).isZero();
    }

    @Test
    void weekendWindow_hasNoAvailableHours() {
        PlanningWindow weekend = PlanningWindow.of(MONDAY.plusDays(5), MONDAY.plusDays(7));
        CapacityReport report = estimator.estimate(weekend, List.of(resource("R1", 100, 10)), sample, null);

        assertThat(report.getWorkingDays()).isZero();
        assertThat(report.getTotalAvailableHours()).isZero();
        assertThat(report.getProjectedEfficiency()).isZero();
    }

    @Test
    void catalogOverload_pullsActiveProcesses() {
        ProcessCatalog catalog = mock(ProcessCatalog.class);
        when(catalog.findActive()).thenReturn(sample);
        CapacityEstimator withCatalog = new CapacityEstimator(catalog, new RecommendationGenerator(), TestData.CLOCK);

        CapacityReport report = withCatalog.estimate(ONE_WEEK, List.of(resource("R1", 100, 10)), DistributionConstraints.none());

        assertThat(report.getPossibleProcessCount()).isEqualTo(3);
        verify(catalog, times(1)).findActive();
    }

    @Test
    void catalogOverload_wrapsCatalogFailure() {
        ProcessCatalog catalog = mock(ProcessCatalog.class);
        IllegalStateException down = new IllegalStateException("db down");
        when(catalog.findActive()).thenThrow(down);
        CapacityEstimator withCatalog = new CapacityEstimator(catalog, new RecommendationGenerator(), TestData.CLOCK);

        assertThatThrownBy(() -> withCatalog.estimate(ONE_WEEK, List.of(resource("R1", 100, 10)), DistributionConstraints.none()))
                .isInstanceOf(AllocationFailedException.class)
                .hasCause(down);
    }

    @Test
    void catalogOverload_nullResultFails() {
        ProcessCatalog catalog = mock(ProcessCatalog.class);
        when(catalog.findActive()).thenReturn(null);
        CapacityEstimator withCatalog = new CapacityEstimator(catalog, new RecommendationGenerator(), TestData.CLOCK);

        assertThatThrownBy(() -> withCatalog.estimate(ONE_WEEK, List.of(resource("R1", 100, 10)), DistributionConstraints.none()))
                .isInstanceOf(AllocationFailedException.class);
    }

    @Test
    void catalogOverload_withoutCatalogFails() {
        assertThatThrownBy(() -> estimator.estimate(ONE_WEEK, List.of(resource("R1", 100, 10)), DistributionConstraints.none()))
                .isInstanceOf(IllegalStateException.class);
    }
}
