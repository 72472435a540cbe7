package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of session timeline entry types. Unknown types are rejected.
 */
public enum TimelineEventType {
    SESSION_STARTED("session_started"),
    SESSION_STOPPED("session_stopped"),
    TASK_STARTED("task_started"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    TASK_SKIPPED("task_skipped"),
    TASK_BLOCKED("task_blocked"),
    NEEDS_INPUT("needs_input"),
    PROGRESS("progress"),
    ERROR("error"),
    MILESTONE("milestone"),
    DOC_ADDED("doc_added");

    private final String wireName;

    TimelineEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TimelineEventType fromWire(String value) {
        return WireNames.parse(TimelineEventType.class, value, TimelineEventType::wireName);
    }
}
