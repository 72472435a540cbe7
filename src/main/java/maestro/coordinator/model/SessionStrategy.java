package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a session receives work: a fixed task list, or a claimable work queue.
 */
public enum SessionStrategy {
    SIMPLE("simple"),
    QUEUE("queue");

    private final String wireName;

    SessionStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionStrategy fromWire(String value) {
        return WireNames.parse(SessionStrategy.class, value, SessionStrategy::wireName);
    }
}
