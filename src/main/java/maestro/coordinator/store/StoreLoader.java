package maestro.coordinator.store;

import maestro.coordinator.model.QueueItem;
import maestro.coordinator.model.QueueItemStatus;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Warm reload of the record store at startup.
 * <p>
 * After loading, cross-references are repaired and the repairs persisted:
 * <ul>
 * <li>references to tasks or sessions that no longer exist are dropped</li>
 * <li>a link recorded on one side only, between two existing records, is
 * completed on the other side</li>
 * <li>queues of deleted sessions are removed; pending items of deleted tasks
 * are marked skipped</li>
 * <li>dangling parent and dependency references are cleared</li>
 * <li>deleted tasks are removed from task lists</li>
 * </ul>
 * Runs before any service accepts requests, so it takes no entity locks.
 */
public final class StoreLoader {

    private static final Logger log = LoggerFactory.getLogger(StoreLoader.class);

    static final String DELETED_TASK_REASON = "task deleted";

    private final RecordStore store;

    public StoreLoader(RecordStore store) {
        this.store = store;
    }

    /**
     * Reload all records and repair them.
     *
     * @return what was repaired
     */
    public HealReport load() {
        store.reload();
        HealReport report = heal();
        if (report.isClean()) {
            log.info("Store loaded, no repairs needed");
        } else {
            log.warn("Store loaded with repairs: {}", report);
        }
        return report;
    }

    HealReport heal() {
        Map<String, Task> tasks = index(store.list(RecordKind.TASK, Task.class), Task::id);
        Map<String, Session> sessions = index(store.list(RecordKind.SESSION, Session.class), Session::id);
        List<WorkQueue> queues = store.list(RecordKind.QUEUE, WorkQueue.class);

        // Each side keeps its own valid references, in its own order
        Map<String, Set<String>> sessionsOfTask = new LinkedHashMap<>();
        Map<String, Set<String>> tasksOfSession = new LinkedHashMap<>();
        int danglingDropped = 0;
        for (Task task : tasks.values()) {
            Set<String> linked = new LinkedHashSet<>();
            for (String sessionId : task.sessionIds()) {
                if (sessions.containsKey(sessionId)) {
                    linked.add(sessionId);
                } else {
                    danglingDropped++;
                }
            }
            sessionsOfTask.put(task.id(), linked);
        }
        for (Session session : sessions.values()) {
            Set<String> linked = new LinkedHashSet<>();
            for (String taskId : session.taskIds()) {
                if (tasks.containsKey(taskId)) {
                    linked.add(taskId);
                } else {
                    danglingDropped++;
                }
            }
            tasksOfSession.put(session.id(), linked);
        }

        // Complete one-sided links
        sessionsOfTask.forEach((taskId, sessionIds) ->
                sessionIds.forEach(sessionId -> tasksOfSession.get(sessionId).add(taskId)));
        tasksOfSession.forEach((sessionId, taskIds) ->
                taskIds.forEach(taskId -> sessionsOfTask.get(taskId).add(sessionId)));

        RecordBatch batch = RecordBatch.create();
        int tasksRepaired = 0;
        int sessionsRepaired = 0;

        for (Task task : tasks.values()) {
            Task repaired = repairTask(task, sessionsOfTask.get(task.id()), tasks);
            if (!repaired.equals(task)) {
                batch.task(repaired);
                tasksRepaired++;
            }
        }
        for (Session session : sessions.values()) {
            List<String> linked = new ArrayList<>(tasksOfSession.get(session.id()));
            if (!linked.equals(session.taskIds())) {
                batch.session(session.toBuilder().taskIds(linked).build());
                sessionsRepaired++;
            }
        }

        int queuesRemoved = 0;
        int queuesRepaired = 0;
        Instant now = Instant.now();
        for (WorkQueue queue : queues) {
            if (!sessions.containsKey(queue.sessionId())) {
                batch.delete(RecordKind.QUEUE, queue.sessionId());
                queuesRemoved++;
                continue;
            }
            WorkQueue repaired = skipDeletedTasks(queue, tasks, now);
            if (repaired != queue) {
                batch.queue(repaired);
                queuesRepaired++;
            }
        }

        int taskListsRepaired = 0;
        for (TaskList taskList : store.list(RecordKind.TASK_LIST, TaskList.class)) {
            List<String> kept = taskList.orderedTaskIds().stream()
                    .filter(tasks::containsKey)
                    .collect(Collectors.toList());
            if (kept.size() != taskList.orderedTaskIds().size()) {
                danglingDropped += taskList.orderedTaskIds().size() - kept.size();
                batch.taskList(taskList.withTaskIds(kept, now));
                taskListsRepaired++;
            }
        }

        if (!batch.isEmpty()) {
            store.commit(batch);
        }
        return new HealReport(danglingDropped, tasksRepaired, sessionsRepaired, queuesRemoved, queuesRepaired,
                taskListsRepaired);
    }

    private static Task repairTask(Task task, Set<String> linkedSessions, Map<String, Task> tasks) {
        List<String> sessionIds = new ArrayList<>(linkedSessions);

        Map<String, TaskSessionStatus> statuses = new LinkedHashMap<>();
        task.taskSessionStatuses().forEach((sessionId, status) -> {
            if (linkedSessions.contains(sessionId)) {
                statuses.put(sessionId, status);
            }
        });

        String parentId = task.parentId() != null && tasks.containsKey(task.parentId()) ? task.parentId() : null;
        List<String> dependencies = task.dependencies().stream()
                .filter(tasks::containsKey)
                .collect(Collectors.toList());

        if (sessionIds.equals(task.sessionIds())
                && statuses.equals(task.taskSessionStatuses())
                && Objects.equals(parentId, task.parentId())
                && dependencies.equals(task.dependencies())) {
            return task;
        }
        return task.toBuilder()
                .sessionIds(sessionIds)
                .taskSessionStatuses(statuses)
                .parentId(parentId)
                .dependencies(dependencies)
                .build();
    }

    private static WorkQueue skipDeletedTasks(WorkQueue queue, Map<String, Task> tasks, Instant now) {
        WorkQueue result = queue;
        for (int i = 0; i < queue.items().size(); i++) {
            QueueItem item = queue.items().get(i);
            if (!item.status().isTerminal() && !tasks.containsKey(item.taskId())) {
                int cursor = result.currentIndex() == i ? result.latestProcessingIndex(i) : result.currentIndex();
                result = result.replace(i, item.finished(QueueItemStatus.SKIPPED, now, DELETED_TASK_REASON),
                        cursor, now);
            }
        }
        return result;
    }

    private static <T> Map<String, T> index(List<T> records, Function<T, String> id) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T record : records) {
            map.put(id.apply(record), record);
        }
        return map;
    }

    /**
     * Summary of the repairs made during a load.
     *
     * @param danglingReferences references to missing records that were dropped
     * @param tasksRepaired      task records rewritten
     * @param sessionsRepaired   session records rewritten
     * @param queuesRemoved      queues of missing sessions deleted
     * @param queuesRepaired     queues whose items of missing tasks were skipped
     * @param taskListsRepaired  task lists that listed missing tasks
     */
    public record HealReport(int danglingReferences, int tasksRepaired, int sessionsRepaired,
            int queuesRemoved, int queuesRepaired, int taskListsRepaired) {

        public boolean isClean() {
            return tasksRepaired == 0 && sessionsRepaired == 0 && queuesRemoved == 0 && queuesRepaired == 0
                    && taskListsRepaired == 0;
        }
    }
}
