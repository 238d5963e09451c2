package com.iimsoft.planner.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 工作项：待分配到资源上的一项工作，带估算工时、优先级和所需能力标签。
 * <p>
 * 分配器只读取 {@link #getStatus()}（只有 PENDING 可分配），其余生命周期迁移由调用方驱动：
 * <pre>
 * PENDING -> IN_PROGRESS -> COMPLETED
 *                        -> PAUSED -> IN_PROGRESS
 * (any but COMPLETED)    -> CANCELLED
 * (any)                  -> ERROR
 * </pre>
 */
public class Process {

    private static final DateTimeFormatter NOTE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String id;
    private String name;
    private String description = "";
    private ProcessType type = ProcessType.ROUTINE;
    private final double estimatedHours;
    private Double actualHours;
    private Priority priority = Priority.MEDIUM;
    private ProcessStatus status = ProcessStatus.PENDING;

    // match-any：资源满足其中任意一个即可
    private final Set<String> requiredCapabilities = new LinkedHashSet<>();
    private final List<String> dependencies = new ArrayList<>();

    private final LocalDateTime createdAt;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private LocalDateTime deadline;

    private String assignedTo;
    private String notes = "";

    public Process(String name, double estimatedHours) {
        this(UUID.randomUUID().toString(), name, estimatedHours, LocalDateTime.now());
    }

    public Process(String id, String name, double estimatedHours) {
        this(id, name, estimatedHours, LocalDateTime.now());
    }

    public Process(String id, String name, double estimatedHours, LocalDateTime createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Process id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Process name must not be blank");
        }
        if (!(estimatedHours > 0)) {
            throw new IllegalArgumentException("estimatedHours must be > 0: " + estimatedHours);
        }
        this.id = id;
        this.name = name;
        this.estimatedHours = estimatedHours;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    // ========== 生命周期 ==========

    public void start(String by) {
        start(by, LocalDateTime.now());
    }

    /**
     * {@code now} 为 null 表示开始时间未知，此时进度固定按一半计、剩余工时无法推算
     */
    public void start(String by, LocalDateTime now) {
        if (status != ProcessStatus.PENDING) {
            throw new IllegalStateException("Cannot start process " + name + " in state " + status);
        }
        status = ProcessStatus.IN_PROGRESS;
        startTime = now;
        if (by != null) {
            assignedTo = by;
        }
        addNote("Process started", now);
    }

    public void pause(String reason) {
        pause(reason, LocalDateTime.now());
    }

    public void pause(String reason, LocalDateTime now) {
        if (status != ProcessStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot pause process " + name + " in state " + status);
        }
        status = ProcessStatus.PAUSED;
        addNote(reason == null || reason.isBlank() ? "Paused" : "Paused: " + reason, now);
    }

    public void resume() {
        resume(LocalDateTime.now());
    }

    public void resume(LocalDateTime now) {
        if (status != ProcessStatus.PAUSED) {
            throw new IllegalStateException("Cannot resume process " + name + " in state " + status);
        }
        status = ProcessStatus.IN_PROGRESS;
        addNote("Process resumed", now);
    }

    public void complete(Double actual) {
        complete(actual, LocalDateTime.now());
    }

    /**
     * Completes the process. Without an explicit {@code actual}, the actual hours are derived from
     * the start and end timestamps.
     */
    public void complete(Double actual, LocalDateTime now) {
        if (status != ProcessStatus.IN_PROGRESS && status != ProcessStatus.PAUSED) {
            throw new IllegalStateException("Cannot complete process " + name + " in state " + status);
        }
        status = ProcessStatus.COMPLETED;
        endTime = now;
        if (actual != null) {
            if (actual < 0) {
                throw new IllegalArgumentException("actual hours must be >= 0: " + actual);
            }
            actualHours = actual;
        } else if (startTime != null) {
            actualHours = Duration.between(startTime, endTime).toSeconds() / 3600.0;
        }
        addNote("Process completed", now);
    }

    public void cancel(String reason) {
        cancel(reason, LocalDateTime.now());
    }

    public void cancel(String reason, LocalDateTime now) {
        if (status == ProcessStatus.COMPLETED) {
            throw new IllegalStateException("Cannot cancel completed process " + name);
        }
        status = ProcessStatus.CANCELLED;
        endTime = now;
        if (reason != null && !reason.isBlank()) {
            addNote("Cancelled: " + reason, now);
        }
    }

    public void markError(String message) {
        markError(message, LocalDateTime.now());
    }

    public void markError(String message, LocalDateTime now) {
        status = ProcessStatus.ERROR;
        endTime = now;
        addNote("Error: " + message, now);
    }

    public void addNote(String note, LocalDateTime at) {
        String line = at == null ? note : "[" + NOTE_TIMESTAMP.format(at) + "] " + note;
        notes = notes.isEmpty() ? line : notes + "\n" + line;
    }

    // ========== 派生 ==========

    public double progress() {
        return progress(LocalDateTime.now());
    }

    /**
     * 0..1；进行中/暂停时按已用时间插值。
     * 缺少开始时间时无法插值，固定返回 0.5（与 {@link #remainingHours} 返回 null 对应）
     */
    public double progress(LocalDateTime now) {
        switch (status) {
            case COMPLETED:
                return 1.0;
            case IN_PROGRESS:
            case PAUSED:
                if (startTime == null) {
                    return 0.5;
                }
                double elapsed = Duration.between(startTime, now).toSeconds() / 3600.0;
                return Math.max(0.0, Math.min(elapsed / estimatedHours, 1.0));
            default:
                return 0.0;
        }
    }

    public boolean isOverdue(LocalDateTime now) {
        if (deadline == null) {
            return false;
        }
        if (status == ProcessStatus.COMPLETED) {
            return endTime != null && endTime.isAfter(deadline);
        }
        return now.isAfter(deadline);
    }

    public boolean canRun() {
        return status == ProcessStatus.PENDING;
    }

    /** Remaining estimated hours, or {@code null} when it cannot be derived. */
    public Double remainingHours(LocalDateTime now) {
        switch (status) {
            case COMPLETED:
                return 0.0;
            case PENDING:
                return estimatedHours;
            case IN_PROGRESS:
            case PAUSED:
                if (startTime == null) {
                    return null;
                }
                double elapsed = Duration.between(startTime, now).toSeconds() / 3600.0;
                return Math.max(0.0, estimatedHours - elapsed);
            default:
                return null;
        }
    }

    public boolean requires(String capability) {
        return requiredCapabilities.contains(capability);
    }

    public void addRequiredCapability(String capability) {
        if (capability != null && !capability.isBlank()) {
            requiredCapabilities.add(capability);
        }
    }

    public void removeRequiredCapability(String capability) {
        requiredCapabilities.remove(capability);
    }

    public void addDependency(String processId) {
        if (processId != null && !dependencies.contains(processId)) {
            dependencies.add(processId);
        }
    }

    public void removeDependency(String processId) {
        dependencies.remove(processId);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public ProcessType getType() { return type; }
    public double getEstimatedHours() { return estimatedHours; }
    public Double getActualHours() { return actualHours; }
    public Priority getPriority() { return priority; }
    public ProcessStatus getStatus() { return status; }
    public Set<String> getRequiredCapabilities() { return Collections.unmodifiableSet(requiredCapabilities); }
    public List<String> getDependencies() { return Collections.unmodifiableList(dependencies); }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public LocalDateTime getDeadline() { return deadline; }
    public String getAssignedTo() { return assignedTo; }
    public String getNotes() { return notes; }

    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Process name must not be blank");
        }
        this.name = name;
    }
    public void setDescription(String description) { this.description = description == null ? "" : description; }
    public void setType(ProcessType type) { this.type = Objects.requireNonNull(type); }
    public void setPriority(Priority priority) { this.priority = Objects.requireNonNull(priority); }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public void setDeadline(LocalDateTime deadline) {
        if (deadline != null && !deadline.isAfter(createdAt)) {
            throw new IllegalArgumentException("deadline must be after creation time");
        }
        this.deadline = deadline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Process)) return false;
        Process process = (Process) o;
        return Objects.equals(id, process.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Process{id='" + id + "', name='" + name + "', hours=" + estimatedHours
                + ", priority=" + priority + ", status=" + status + "}";
    }
}
