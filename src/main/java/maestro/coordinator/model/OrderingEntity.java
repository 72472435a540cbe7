package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of project entities whose display order can be saved.
 */
public enum OrderingEntity {
    TASK("task"),
    SESSION("session"),
    TASK_LIST("task-list");

    private final String wireName;

    OrderingEntity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OrderingEntity fromWire(String value) {
        return WireNames.parse(OrderingEntity.class, value, OrderingEntity::wireName);
    }
}
