package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A single session's view of a task, kept apart from the task's overall status
 * so sessions working the same task do not overwrite each other.
 */
public enum TaskSessionStatus {
    QUEUED("queued"),
    WORKING("working"),
    BLOCKED("blocked"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireName;

    TaskSessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isActive() {
        return this == QUEUED || this == WORKING || this == BLOCKED;
    }

    @JsonCreator
    public static TaskSessionStatus fromWire(String value) {
        return WireNames.parse(TaskSessionStatus.class, value, TaskSessionStatus::wireName);
    }
}
