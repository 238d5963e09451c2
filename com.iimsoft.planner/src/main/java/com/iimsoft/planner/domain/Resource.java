package com.iimsoft.planner.domain;

import com.iimsoft.planner.calendar.WorkSchedule;
import org.optaplanner.core.api.domain.lookup.PlanningId;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 资源：有容量上限、小时成本、能力标签和工作日历的供给方（人员、设备、预算等）。
 * <p>
 * 不变式：{@code 0 <= currentCapacity <= maxCapacity}。
 * 容量只通过 {@link #assign(String, double)} / {@link #release(String)} 变更，每次变更写入历史。
 */
public class Resource {

    public static final double DEFAULT_HOURS_PER_DAY = 8.0;
    public static final double DEFAULT_HOURS_PER_WEEK = 40.0;

    @PlanningId
    private final String id;
    private String name;
    private String description = "";
    private final ResourceType type;
    private ResourceStatus status = ResourceStatus.AVAILABLE;

    private final double maxCapacity;
    private double currentCapacity;
    private double costPerHour;

    private String location = "";
    private String owner = "";

    private final Set<String> capabilities = new LinkedHashSet<>();
    private ExperienceLevel experience;
    private WorkSchedule schedule;

    private final LocalDateTime createdAt;
    private LocalDateTime modifiedAt;

    private final List<String> assignedProcessIds = new ArrayList<>();
    private final List<AssignmentRecord> history = new ArrayList<>();
    private final List<StatusChange> statusChanges = new ArrayList<>();

    public Resource(String name, ResourceType type, double maxCapacity) {
        this(UUID.randomUUID().toString(), name, type, maxCapacity, 0.0, 0.0);
    }

    public Resource(String id, String name, ResourceType type, double maxCapacity, double currentCapacity, double costPerHour) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Resource id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        if (!(maxCapacity > 0)) {
            throw new IllegalArgumentException("maxCapacity must be > 0: " + maxCapacity);
        }
        if (currentCapacity < 0) {
            throw new IllegalArgumentException("currentCapacity must be >= 0: " + currentCapacity);
        }
        if (currentCapacity > maxCapacity) {
            throw new IllegalArgumentException("currentCapacity " + currentCapacity + " exceeds maxCapacity " + maxCapacity);
        }
        if (costPerHour < 0) {
            throw new IllegalArgumentException("costPerHour must be >= 0: " + costPerHour);
        }
        this.id = id;
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.maxCapacity = maxCapacity;
        this.currentCapacity = currentCapacity;
        this.costPerHour = costPerHour;
        this.createdAt = LocalDateTime.now();
        this.modifiedAt = createdAt;
        // 人力资源默认白班日历
        if (type == ResourceType.HUMAN) {
            this.schedule = WorkSchedule.defaultOfficeHours();
        }
    }

    // ========== 容量 ==========

    public double getAvailableCapacity() {
        return maxCapacity - currentCapacity;
    }

    public double getUtilizationPercent() {
        return currentCapacity / maxCapacity * 100.0;
    }

    public boolean isAvailable() {
        return status == ResourceStatus.AVAILABLE && getAvailableCapacity() > 0;
    }

    public boolean canAccept(double hours) {
        return isAvailable() && getAvailableCapacity() >= hours;
    }

    public double getHoursPerDay() {
        return schedule == null ? DEFAULT_HOURS_PER_DAY : schedule.getHoursPerDay();
    }

    public double getHoursPerWeek() {
        return schedule == null ? DEFAULT_HOURS_PER_WEEK : schedule.getHoursPerWeek();
    }

    public double costFor(double hours) {
        return costPerHour * hours;
    }

    public void assign(String processId, double amount) {
        if (!canAccept(amount)) {
            throw new IllegalStateException("Cannot assign resource " + name + " to process " + processId);
        }
        if (assignedProcessIds.contains(processId)) {
            throw new IllegalStateException("Process " + processId + " is already assigned to resource " + name);
        }
        double before = currentCapacity;
        assignedProcessIds.add(processId);
        currentCapacity += amount;
        if (currentCapacity >= maxCapacity) {
            status = ResourceStatus.ASSIGNED;
        }
        LocalDateTime now = LocalDateTime.now();
        history.add(new AssignmentRecord(processId, amount, AssignmentRecord.Action.ASSIGNED, now, before, currentCapacity));
        modifiedAt = now;
    }

    /**
     * Releases the capacity recorded by the matching {@code assign} call.
     */
    public void release(String processId) {
        if (!assignedProcessIds.contains(processId)) {
            throw new IllegalStateException("Process " + processId + " is not assigned to resource " + name);
        }
        double amount = 0.0;
        for (AssignmentRecord r : history) {
            if (r.getProcessId().equals(processId) && r.getAction() == AssignmentRecord.Action.ASSIGNED) {
                amount = r.getAmount();
            }
        }
        double before = currentCapacity;
        assignedProcessIds.remove(processId);
        currentCapacity = Math.max(0.0, currentCapacity - amount);
        if (currentCapacity < maxCapacity && status == ResourceStatus.ASSIGNED) {
            status = ResourceStatus.AVAILABLE;
        }
        LocalDateTime now = LocalDateTime.now();
        history.add(new AssignmentRecord(processId, amount, AssignmentRecord.Action.RELEASED, now, before, currentCapacity));
        modifiedAt = now;
    }

    public void changeStatus(ResourceStatus newStatus, String reason) {
        Objects.requireNonNull(newStatus, "newStatus");
        LocalDateTime now = LocalDateTime.now();
        statusChanges.add(new StatusChange(now, status, newStatus, reason == null ? "" : reason));
        status = newStatus;
        modifiedAt = now;
    }

    // ========== 能力 ==========

    /**
     * A requirement tag is met by a capability with the same tag, or by a resource whose name is the tag.
     */
    public boolean matches(String requirement) {
        return capabilities.contains(requirement) || name.equals(requirement);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public void addCapability(String capability) {
        if (capability != null && !capability.isBlank() && capabilities.add(capability)) {
            modifiedAt = LocalDateTime.now();
        }
    }

    public void removeCapability(String capability) {
        if (capabilities.remove(capability)) {
            modifiedAt = LocalDateTime.now();
        }
    }

    public boolean isExperienced() {
        return experience != null && experience.isExperienced();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public ResourceType getType() { return type; }
    public ResourceStatus getStatus() { return status; }
    public double getMaxCapacity() { return maxCapacity; }
    public double getCurrentCapacity() { return currentCapacity; }
    public double getCostPerHour() { return costPerHour; }
    public String getLocation() { return location; }
    public String getOwner() { return owner; }
    public Set<String> getCapabilities() { return Collections.unmodifiableSet(capabilities); }
    public ExperienceLevel getExperience() { return experience; }
    public WorkSchedule getSchedule() { return schedule; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getModifiedAt() { return modifiedAt; }
    public List<String> getAssignedProcessIds() { return Collections.unmodifiableList(assignedProcessIds); }
    public List<AssignmentRecord> getHistory() { return Collections.unmodifiableList(history); }
    public List<StatusChange> getStatusChanges() { return Collections.unmodifiableList(statusChanges); }

    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        this.name = name;
    }
    public void setDescription(String description) { this.description = description == null ? "" : description; }
    public void setLocation(String location) { this.location = location == null ? "" : location; }
    public void setOwner(String owner) { this.owner = owner == null ? "" : owner; }
    public void setExperience(ExperienceLevel experience) { this.experience = experience; }
    public void setSchedule(WorkSchedule schedule) { this.schedule = schedule; }

    public void setCostPerHour(double costPerHour) {
        if (costPerHour < 0) {
            throw new IllegalArgumentException("costPerHour must be >= 0: " + costPerHour);
        }
        this.costPerHour = costPerHour;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resource)) return false;
        Resource resource = (Resource) o;
        return Objects.equals(id, resource.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Resource{id='" + id + "', name='" + name + "', type=" + type + ", status=" + status
                + ", capacity=" + currentCapacity + "/" + maxCapacity + "}";
    }
}
