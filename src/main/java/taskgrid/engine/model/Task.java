package taskgrid.engine.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model representing a unit of work.
 * Lifecycle fields (status, assignee, attempts, history) are filled in by the
 * orchestrator when a snapshot is taken; callers only supply the definition.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Task {
    private final String id;
    private final String title;
    private final String description;
    private final TaskPriority priority;
    private final Set<String> requiredCapabilities;
    private final List<String> dependsOn; // hard dependencies, ordered
    private final List<String> prefers; // soft, never blocking
    private final List<String> conflictsWith; // advisory
    private final List<String> tags;
    private final Duration estimatedDuration;
    private final TaskStatus status;
    private final String assignedTo; // worker ID or null
    private final int attempts;
    private final Instant createdAt;
    private final Instant completedAt;
    private final List<HistoryEntry> history;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = builder.title;
        this.description = builder.description;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredCapabilities));
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.prefers = List.copyOf(builder.prefers);
        this.conflictsWith = List.copyOf(builder.conflictsWith);
        this.tags = List.copyOf(builder.tags);
        this.estimatedDuration = builder.estimatedDuration;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.assignedTo = builder.assignedTo;
        this.attempts = builder.attempts;
        this.createdAt = builder.createdAt;
        this.completedAt = builder.completedAt;
        this.history = List.copyOf(builder.history);
    }

    // Getters
    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public TaskPriority priority() {
        return priority;
    }

    public Set<String> requiredCapabilities() {
        return requiredCapabilities;
    }

    public List<String> dependsOn() {
        return dependsOn;
    }

    public List<String> prefers() {
        return prefers;
    }

    public List<String> conflictsWith() {
        return conflictsWith;
    }

    public List<String> tags() {
        return tags;
    }

    public Duration estimatedDuration() {
        return estimatedDuration;
    }

    public TaskStatus status() {
        return status;
    }

    public String assignedTo() {
        return assignedTo;
    }

    public int attempts() {
        return attempts;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public List<HistoryEntry> history() {
        return history;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .priority(priority)
                .requiredCapabilities(requiredCapabilities)
                .dependsOn(dependsOn)
                .prefers(prefers)
                .conflictsWith(conflictsWith)
                .tags(tags)
                .estimatedDuration(estimatedDuration)
                .status(status)
                .assignedTo(assignedTo)
                .attempts(attempts)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .history(history);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private TaskPriority priority = TaskPriority.NORMAL;
        private Collection<String> requiredCapabilities = List.of();
        private List<String> dependsOn = List.of();
        private List<String> prefers = List.of();
        private List<String> conflictsWith = List.of();
        private List<String> tags = List.of();
        private Duration estimatedDuration;
        private TaskStatus status = TaskStatus.PENDING;
        private String assignedTo;
        private int attempts = 0;
        private Instant createdAt;
        private Instant completedAt;
        private List<HistoryEntry> history = List.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder requiredCapabilities(Collection<String> requiredCapabilities) {
            this.requiredCapabilities = requiredCapabilities == null ? List.of() : requiredCapabilities;
            return this;
        }

        public Builder requiredCapabilities(String... requiredCapabilities) {
            return requiredCapabilities(List.of(requiredCapabilities));
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn == null ? List.of() : new ArrayList<>(dependsOn);
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            return dependsOn(List.of(dependsOn));
        }

        public Builder prefers(List<String> prefers) {
            this.prefers = prefers == null ? List.of() : new ArrayList<>(prefers);
            return this;
        }

        public Builder conflictsWith(List<String> conflictsWith) {
            this.conflictsWith = conflictsWith == null ? List.of() : new ArrayList<>(conflictsWith);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags == null ? List.of() : new ArrayList<>(tags);
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder history(List<HistoryEntry> history) {
            this.history = history == null ? List.of() : new ArrayList<>(history);
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', priority=" + priority + ", status=" + status
                + ", assignedTo='" + assignedTo + "'}";
    }
}
