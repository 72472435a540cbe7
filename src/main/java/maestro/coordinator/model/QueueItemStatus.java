package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Queue item state machine: {@code queued -> processing -> {completed, failed, skipped}}.
 */
public enum QueueItemStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireName;

    QueueItemStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    @JsonCreator
    public static QueueItemStatus fromWire(String value) {
        return WireNames.parse(QueueItemStatus.class, value, QueueItemStatus::wireName);
    }
}
