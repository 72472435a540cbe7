package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Worker session lifecycle status.
 * Terminal statuses freeze work assignment and stamp a completion time.
 */
public enum SessionStatus {
    SPAWNING("spawning"),
    IDLE("idle"),
    WORKING("working"),
    COMPLETED("completed"),
    FAILED("failed"),
    STOPPED("stopped");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return WireNames.parse(SessionStatus.class, value, SessionStatus::wireName);
    }
}
