package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of work.
 * <p>
 * {@code sessionIds} is the task side of the task/session relationship and is
 * only rewritten by the relationship maintainer. {@code taskSessionStatuses}
 * holds each session's own view of the task, separate from {@code status}.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
@JsonDeserialize(builder = Task.Builder.class)
public final class Task {
    private final String id;
    private final String projectId;
    private final String parentId;
    private final String title;
    private final String description;
    private final TaskStatus status;
    private final TaskPriority priority;
    private final List<String> sessionIds;
    private final Map<String, TaskSessionStatus> taskSessionStatuses;
    private final List<String> dependencies;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId is required");
        this.parentId = builder.parentId;
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description == null ? "" : builder.description;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.sessionIds = List.copyOf(new LinkedHashSet<>(builder.sessionIds));
        this.taskSessionStatuses = Map.copyOf(builder.taskSessionStatuses);
        this.dependencies = List.copyOf(builder.dependencies);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String parentId() {
        return parentId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskPriority priority() {
        return priority;
    }

    public List<String> sessionIds() {
        return sessionIds;
    }

    public Map<String, TaskSessionStatus> taskSessionStatuses() {
        return taskSessionStatuses;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean hasSession(String sessionId) {
        return sessionIds.contains(sessionId);
    }

    /** The given session's own status for this task, or null. */
    public TaskSessionStatus sessionStatus(String sessionId) {
        return taskSessionStatuses.get(sessionId);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectId(projectId)
                .parentId(parentId)
                .title(title)
                .description(description)
                .status(status)
                .priority(priority)
                .sessionIds(sessionIds)
                .taskSessionStatuses(taskSessionStatuses)
                .dependencies(dependencies)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String id;
        private String projectId;
        private String parentId;
        private String title;
        private String description;
        private TaskStatus status = TaskStatus.TODO;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private List<String> sessionIds = new ArrayList<>();
        private Map<String, TaskSessionStatus> taskSessionStatuses = new LinkedHashMap<>();
        private List<String> dependencies = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
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

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder sessionIds(Collection<String> sessionIds) {
            this.sessionIds = sessionIds == null ? new ArrayList<>() : new ArrayList<>(sessionIds);
            return this;
        }

        public Builder taskSessionStatuses(Map<String, TaskSessionStatus> statuses) {
            this.taskSessionStatuses = statuses == null ? new LinkedHashMap<>() : new LinkedHashMap<>(statuses);
            return this;
        }

        public Builder dependencies(Collection<String> dependencies) {
            this.dependencies = dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
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
        return Objects.equals(id, task.id)
                && Objects.equals(projectId, task.projectId)
                && Objects.equals(parentId, task.parentId)
                && Objects.equals(title, task.title)
                && Objects.equals(description, task.description)
                && status == task.status
                && priority == task.priority
                && Objects.equals(sessionIds, task.sessionIds)
                && Objects.equals(taskSessionStatuses, task.taskSessionStatuses)
                && Objects.equals(dependencies, task.dependencies)
                && Objects.equals(createdAt, task.createdAt)
                && Objects.equals(updatedAt, task.updatedAt)
                && Objects.equals(startedAt, task.startedAt)
                && Objects.equals(completedAt, task.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", sessions=" + sessionIds + "}";
    }
}
