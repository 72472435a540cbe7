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
 * Immutable domain model of a worker session.
 * <p>
 * {@code taskIds} is the session side of the task/session relationship.
 * {@code timeline} only ever grows.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
@JsonDeserialize(builder = Session.Builder.class)
public final class Session {
    private final String id;
    private final String projectId;
    private final List<String> taskIds;
    private final String name;
    private final SessionStatus status;
    private final SessionStrategy strategy;
    private final Map<String, String> env;
    private final Map<String, String> metadata;
    private final List<TimelineEvent> timeline;
    private final NeedsInput needsInput;
    private final Instant startedAt;
    private final Instant lastActivity;
    private final Instant completedAt;

    private Session(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId is required");
        this.taskIds = List.copyOf(new LinkedHashSet<>(builder.taskIds));
        this.name = builder.name == null ? "Unnamed Session" : builder.name;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.strategy = builder.strategy == null ? SessionStrategy.SIMPLE : builder.strategy;
        this.env = Map.copyOf(builder.env);
        this.metadata = Map.copyOf(builder.metadata);
        this.timeline = List.copyOf(builder.timeline);
        this.needsInput = builder.needsInput;
        this.startedAt = builder.startedAt;
        this.lastActivity = builder.lastActivity;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public List<String> taskIds() {
        return taskIds;
    }

    public String name() {
        return name;
    }

    public SessionStatus status() {
        return status;
    }

    public SessionStrategy strategy() {
        return strategy;
    }

    public Map<String, String> env() {
        return env;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public List<TimelineEvent> timeline() {
        return timeline;
    }

    public NeedsInput needsInput() {
        return needsInput;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean hasTask(String taskId) {
        return taskIds.contains(taskId);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isWaitingForInput() {
        return needsInput != null && needsInput.active();
    }

    /** Copy with one more timeline entry and a refreshed activity stamp. */
    public Session append(TimelineEvent event) {
        List<TimelineEvent> next = new ArrayList<>(timeline);
        next.add(event);
        return toBuilder().timeline(next).lastActivity(event.timestamp()).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectId(projectId)
                .taskIds(taskIds)
                .name(name)
                .status(status)
                .strategy(strategy)
                .env(env)
                .metadata(metadata)
                .timeline(timeline)
                .needsInput(needsInput)
                .startedAt(startedAt)
                .lastActivity(lastActivity)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String id;
        private String projectId;
        private List<String> taskIds = new ArrayList<>();
        private String name;
        private SessionStatus status = SessionStatus.SPAWNING;
        private SessionStrategy strategy = SessionStrategy.SIMPLE;
        private Map<String, String> env = new LinkedHashMap<>();
        private Map<String, String> metadata = new LinkedHashMap<>();
        private List<TimelineEvent> timeline = new ArrayList<>();
        private NeedsInput needsInput;
        private Instant startedAt;
        private Instant lastActivity;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder taskIds(Collection<String> taskIds) {
            this.taskIds = taskIds == null ? new ArrayList<>() : new ArrayList<>(taskIds);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder strategy(SessionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env == null ? new LinkedHashMap<>() : new LinkedHashMap<>(env);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder timeline(List<TimelineEvent> timeline) {
            this.timeline = timeline == null ? new ArrayList<>() : new ArrayList<>(timeline);
            return this;
        }

        public Builder needsInput(NeedsInput needsInput) {
            this.needsInput = needsInput;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder lastActivity(Instant lastActivity) {
            this.lastActivity = lastActivity;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Session build() {
            return new Session(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Session session))
            return false;
        return Objects.equals(id, session.id)
                && Objects.equals(projectId, session.projectId)
                && Objects.equals(taskIds, session.taskIds)
                && Objects.equals(name, session.name)
                && status == session.status
                && strategy == session.strategy
                && Objects.equals(env, session.env)
                && Objects.equals(metadata, session.metadata)
                && Objects.equals(timeline, session.timeline)
                && Objects.equals(needsInput, session.needsInput)
                && Objects.equals(startedAt, session.startedAt)
                && Objects.equals(lastActivity, session.lastActivity)
                && Objects.equals(completedAt, session.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Session{id='" + id + "', status=" + status + ", tasks=" + taskIds + "}";
    }
}
