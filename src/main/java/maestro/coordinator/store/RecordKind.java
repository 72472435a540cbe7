package maestro.coordinator.store;

import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.Project;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.model.WorkQueue;

/**
 * Kinds of persisted records, with the type each kind's body decodes to.
 */
public enum RecordKind {
    PROJECT("project", Project.class),
    TASK("task", Task.class),
    SESSION("session", Session.class),
    QUEUE("queue", WorkQueue.class),
    TASK_LIST("task_list", TaskList.class),
    ORDERING("ordering", Ordering.class);

    private final String column;
    private final Class<?> type;

    RecordKind(String column, Class<?> type) {
        this.column = column;
        this.type = type;
    }

    /** Value stored in the {@code kind} column. */
    public String column() {
        return column;
    }

    public Class<?> type() {
        return type;
    }
}
