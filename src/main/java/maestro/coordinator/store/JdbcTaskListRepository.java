package maestro.coordinator.store;

import maestro.coordinator.model.TaskList;
import maestro.coordinator.repository.TaskListRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TaskListRepository backed by the {@link RecordStore}.
 */
public class JdbcTaskListRepository implements TaskListRepository {

    private static final Comparator<TaskList> BY_CREATION = Comparator.comparing(TaskList::createdAt,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final RecordStore store;

    public JdbcTaskListRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(TaskList taskList) {
        store.commit(RecordBatch.create().taskList(taskList));
    }

    @Override
    public Optional<TaskList> findById(String taskListId) {
        return store.find(RecordKind.TASK_LIST, taskListId, TaskList.class);
    }

    @Override
    public List<TaskList> findByProjectId(String projectId) {
        return findAll().stream()
                .filter(list -> list.projectId().equals(projectId))
                .collect(Collectors.toList());
    }

    @Override
    public List<TaskList> findByTaskId(String taskId) {
        return findAll().stream()
                .filter(list -> list.contains(taskId))
                .collect(Collectors.toList());
    }

    @Override
    public List<TaskList> findAll() {
        List<TaskList> lists = store.list(RecordKind.TASK_LIST, TaskList.class);
        lists.sort(BY_CREATION);
        return lists;
    }

    @Override
    public boolean delete(String taskListId) {
        if (findById(taskListId).isEmpty()) {
            return false;
        }
        store.commit(RecordBatch.create().delete(RecordKind.TASK_LIST, taskListId));
        return true;
    }
}
