package com.iimsoft.planner.app;

import com.iimsoft.planner.capacity.CapacityReport;
import com.iimsoft.planner.capacity.PlanningWindow;
import com.iimsoft.planner.config.PlannerSettings;
import com.iimsoft.planner.config.PlannerSettingsLoader;
import com.iimsoft.planner.distribution.DistributionConstraints;
import com.iimsoft.planner.distribution.DistributionResult;
import com.iimsoft.planner.distribution.DistributionStrategy;
import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.ExperienceLevel;
import com.iimsoft.planner.domain.Priority;
import com.iimsoft.planner.domain.Process;
import com.iimsoft.planner.domain.Resource;
import com.iimsoft.planner.domain.ResourceType;
import com.iimsoft.planner.optimization.OptimizationAlgorithm;
import com.iimsoft.planner.optimization.OptimizationParameters;
import com.iimsoft.planner.optimization.OptimizationResult;
import com.iimsoft.planner.service.PlanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Demo runner: builds a small team and backlog, then runs capacity, distribution and every
 * optimization algorithm over it.
 */
public class PlannerApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlannerApp.class);

    private final PlanningService service;
    private final Clock clock;

    public PlannerApp(PlanningService service, Clock clock) {
        this.service = service;
        this.clock = clock;
    }

    public static void main(String[] args) {
        PlannerSettings settings = new PlannerSettingsLoader().load();
        Clock clock = Clock.systemDefaultZone();
        new PlannerApp(new PlanningService(settings, clock), clock).run();
    }

    /**
     * @return objective value per algorithm actually used
     */
    public Map<OptimizationAlgorithm, Double> run() {
        LOGGER.info("======================================");
        LOGGER.info("Resource Planner demo");
        LOGGER.info("======================================");

        List<Resource> resources = createResources();
        List<Process> processes = createProcesses();

        // 1. 产能
        CapacityReport capacity = service.computeCapacity(nextWorkWeek(clock),
                resources, processes, DistributionConstraints.none());
        LOGGER.info("Capacity: {} possible processes, {} h available, {} h required, efficiency {}%",
                capacity.getPossibleProcessCount(), capacity.getTotalAvailableHours(),
                capacity.getTotalRequiredHours(), String.format("%.1f", capacity.getProjectedEfficiency()));
        capacity.getRecommendations().forEach(r -> LOGGER.info("  * {}", r));

        // 2. 分配
        DistributionResult distribution = service.distribute(processes, resources, DistributionStrategy.PRIORITY,
                DistributionConstraints.builder().maxHoursPerResource(60.0).build());
        LOGGER.info("Distribution ({}): {} assigned, {} unassigned, total cost {}",
                distribution.getStrategy(), distribution.getAssignedCount(), distribution.getUnassigned().size(),
                distribution.getMetrics().getTotalCost());
        for (Assignment a : distribution.getAssignments()) {
            LOGGER.info("  {} -> {} [{} .. {}] cost {}", a.getProcessId(), a.getResourceId(),
                    a.getStartTime(), a.getEndTime(), a.getEstimatedCost());
        }
        distribution.getRecommendations().forEach(r -> LOGGER.info("  * {}", r));

        // 3. 优化
        Map<OptimizationAlgorithm, Double> objectives = new EnumMap<>(OptimizationAlgorithm.class);
        for (OptimizationAlgorithm algorithm : OptimizationAlgorithm.values()) {
            OptimizationParameters params = OptimizationParameters.of(algorithm).withSeed(42L);
            OptimizationResult result = service.optimize(processes, resources, params);
            LOGGER.info("{} (used {}): objective {}, {} assignments, {} iterations, converged={}, {} ms",
                    algorithm, result.getAlgorithmUsed(), result.getObjectiveValue(), result.getAssignments().size(),
                    result.getIterations(), result.isConverged(), result.getElapsed().toMillis());
            objectives.put(result.getAlgorithmUsed(), result.getObjectiveValue());
        }
        return objectives;
    }

    /** 下一个周一起的一整周 */
    static PlanningWindow nextWorkWeek(Clock clock) {
        LocalDate monday = LocalDate.now(clock).with(TemporalAdjusters.next(DayOfWeek.MONDAY));
        return PlanningWindow.of(monday, monday.plusWeeks(1));
    }

    static List<Resource> createResources() {
        Resource alice = new Resource("R-ALICE", "Alice", ResourceType.HUMAN, 40.0, 0.0, 45.0);
        alice.addCapability("java");
        alice.addCapability("sql");
        alice.setExperience(ExperienceLevel.SENIOR);

        Resource bob = new Resource("R-BOB", "Bob", ResourceType.HUMAN, 40.0, 0.0, 30.0);
        bob.addCapability("python");
        bob.addCapability("sql");
        bob.setExperience(ExperienceLevel.JUNIOR);

        Resource rig = new Resource("R-RIG", "Test rig", ResourceType.TECHNOLOGICAL, 80.0, 10.0, 12.0);
        rig.addCapability("testing");

        List<Resource> resources = new ArrayList<>();
        resources.add(alice);
        resources.add(bob);
        resources.add(rig);
        return resources;
    }

    static List<Process> createProcesses() {
        List<Process> processes = new ArrayList<>();
        processes.add(process("P-API", "Billing API", 16.0, Priority.HIGH, "java"));
        processes.add(process("P-ETL", "Nightly ETL", 12.0, Priority.MEDIUM, "python", "sql"));
        processes.add(process("P-REPORT", "Quarterly report", 6.0, Priority.LOW, "sql"));
        processes.add(process("P-REGRESSION", "Regression suite", 20.0, Priority.CRITICAL, "testing"));
        processes.add(process("P-DOCS", "Release notes", 4.0, Priority.LOW));
        return processes;
    }

    private static Process process(String id, String name, double hours, Priority priority, String... capabilities) {
        Process p = new Process(id, name, hours);
        p.setPriority(priority);
        for (String c : capabilities) {
            p.addRequiredCapability(c);
        }
        return p;
    }
}
