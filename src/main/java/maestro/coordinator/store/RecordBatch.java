package maestro.coordinator.store;

import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.Project;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.model.WorkQueue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of record writes and deletes committed together by {@link RecordStore#commit}.
 * A later operation on the same record replaces an earlier one.
 */
public final class RecordBatch {

    private final Map<String, Op> ops = new LinkedHashMap<>();

    private RecordBatch() {
    }

    public static RecordBatch create() {
        return new RecordBatch();
    }

    public RecordBatch put(RecordKind kind, String id, Object record) {
        Objects.requireNonNull(record, "record");
        if (!kind.type().isInstance(record)) {
            throw new IllegalArgumentException(kind + " record expected, got " + record.getClass().getSimpleName());
        }
        ops.put(key(kind, id), new Op(kind, id, record));
        return this;
    }

    public RecordBatch delete(RecordKind kind, String id) {
        ops.put(key(kind, id), new Op(kind, id, null));
        return this;
    }

    public RecordBatch project(Project project) {
        return put(RecordKind.PROJECT, project.id(), project);
    }

    public RecordBatch task(Task task) {
        return put(RecordKind.TASK, task.id(), task);
    }

    public RecordBatch session(Session session) {
        return put(RecordKind.SESSION, session.id(), session);
    }

    public RecordBatch queue(WorkQueue queue) {
        return put(RecordKind.QUEUE, queue.sessionId(), queue);
    }

    public RecordBatch taskList(TaskList taskList) {
        return put(RecordKind.TASK_LIST, taskList.id(), taskList);
    }

    public RecordBatch ordering(Ordering ordering) {
        return put(RecordKind.ORDERING, Ordering.key(ordering.projectId(), ordering.entityType()), ordering);
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public int size() {
        return ops.size();
    }

    List<Op> ops() {
        return new ArrayList<>(ops.values());
    }

    private static String key(RecordKind kind, String id) {
        return kind.column() + "/" + Objects.requireNonNull(id, "id");
    }

    /** A put ({@code record != null}) or a delete. */
    record Op(RecordKind kind, String id, Object record) {

        boolean isDelete() {
            return record == null;
        }
    }
}
