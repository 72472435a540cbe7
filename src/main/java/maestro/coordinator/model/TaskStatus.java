package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Overall task lifecycle status.
 * <pre>
 * todo -> in_progress -> {in_review, blocked, completed, cancelled}
 * in_review -> {in_progress, completed}
 * blocked -> in_progress
 * </pre>
 * {@code completed} and {@code cancelled} are terminal.
 */
public enum TaskStatus {
    TODO("todo"),
    IN_PROGRESS("in_progress"),
    IN_REVIEW("in_review"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    BLOCKED("blocked");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** Statuses reachable from this one in a single transition. */
    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case TODO -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(IN_REVIEW, BLOCKED, COMPLETED, CANCELLED);
            case IN_REVIEW -> EnumSet.of(IN_PROGRESS, COMPLETED);
            case BLOCKED -> EnumSet.of(IN_PROGRESS);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        return WireNames.parse(TaskStatus.class, value, TaskStatus::wireName);
    }
}
