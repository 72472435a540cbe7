package maestro.coordinator.store;

import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskStatus;
import maestro.coordinator.repository.TaskRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * TaskRepository backed by the {@link RecordStore}: queries run against the
 * in-memory mirror, writes go through to the {@code records} table.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Comparator<Task> BY_CREATION = Comparator
            .comparing(Task::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(Task::id);

    private final RecordStore store;

    public JdbcTaskRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(Task task) {
        store.commit(RecordBatch.create().task(task));
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return store.find(RecordKind.TASK, taskId, Task.class);
    }

    @Override
    public List<Task> findAll() {
        return filter(t -> true);
    }

    @Override
    public List<Task> findByProjectId(String projectId) {
        return filter(t -> t.projectId().equals(projectId));
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return filter(t -> t.status() == status);
    }

    @Override
    public List<Task> findByParentId(String parentId) {
        return filter(t -> Objects.equals(t.parentId(), parentId));
    }

    @Override
    public List<Task> findBySessionId(String sessionId) {
        return filter(t -> t.hasSession(sessionId));
    }

    @Override
    public int count() {
        return store.count(RecordKind.TASK);
    }

    @Override
    public boolean delete(String taskId) {
        if (findById(taskId).isEmpty()) {
            return false;
        }
        store.commit(RecordBatch.create().delete(RecordKind.TASK, taskId));
        return true;
    }

    private List<Task> filter(Predicate<Task> predicate) {
        return store.list(RecordKind.TASK, Task.class).stream()
                .filter(predicate)
                .sorted(BY_CREATION)
                .collect(Collectors.toList());
    }
}
