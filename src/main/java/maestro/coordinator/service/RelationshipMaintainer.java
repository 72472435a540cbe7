package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.Outbox;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.repository.SessionRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.store.RecordBatch;
import maestro.coordinator.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps task.sessionIds and session.taskIds mutually consistent.
 * <p>
 * Both sides of a link change in one {@link RecordBatch}, so a reader sees
 * either the old or the new pair. Only the cross-reference arrays, the
 * per-session status entry of a detached session and the session's
 * {@code lastActivity} are rewritten.
 * <p>
 * The public operations lock both entities themselves. The package-private
 * building blocks expect the caller to hold the locks of every record they touch.
 */
public class RelationshipMaintainer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipMaintainer.class);

    private final RecordStore store;
    private final TaskRepository taskRepository;
    private final SessionRepository sessionRepository;
    private final KeyedLocks locks;
    private final EventBus eventBus;

    public RelationshipMaintainer(RecordStore store, TaskRepository taskRepository,
            SessionRepository sessionRepository, KeyedLocks locks, EventBus eventBus) {
        this.store = store;
        this.taskRepository = taskRepository;
        this.sessionRepository = sessionRepository;
        this.locks = locks;
        this.eventBus = eventBus;
    }

    /**
     * Link a task to a session. Linking an already linked pair is a no-op.
     *
     * @return true if the link was created
     * @throws NotFoundException if either side does not exist
     */
    public boolean attachTask(String sessionId, String taskId) {
        Outbox outbox = new Outbox();
        boolean changed = locks.withLocks(List.of(KeyedLocks.sessionKey(sessionId), KeyedLocks.taskKey(taskId)),
                () -> {
                    Session session = requireSession(sessionId);
                    Task task = requireTask(taskId);
                    RecordBatch batch = RecordBatch.create();
                    Pair pair = link(session, task, batch, outbox);
                    store.commit(batch);
                    return pair.changed();
                });
        outbox.publishTo(eventBus);
        if (changed) {
            log.debug("Linked task {} to session {}", taskId, sessionId);
        }
        return changed;
    }

    /**
     * Unlink a task from a session. Unlinking a pair that is not linked is a no-op.
     *
     * @return true if a link was removed
     * @throws NotFoundException if either side does not exist
     */
    public boolean detachTask(String sessionId, String taskId) {
        Outbox outbox = new Outbox();
        boolean changed = locks.withLocks(List.of(KeyedLocks.sessionKey(sessionId), KeyedLocks.taskKey(taskId)),
                () -> {
                    Session session = requireSession(sessionId);
                    Task task = requireTask(taskId);
                    RecordBatch batch = RecordBatch.create();
                    Pair pair = unlink(session, task, batch, outbox);
                    store.commit(batch);
                    return pair.changed();
                });
        outbox.publishTo(eventBus);
        if (changed) {
            log.debug("Unlinked task {} from session {}", taskId, sessionId);
        }
        return changed;
    }

    public boolean attachSession(String taskId, String sessionId) {
        return attachTask(sessionId, taskId);
    }

    public boolean detachSession(String taskId, String sessionId) {
        return detachTask(sessionId, taskId);
    }

    // ---- building blocks, caller holds the locks ----

    /**
     * Lock keys covering a session and every task linked to it from either side.
     */
    Set<String> sessionLockKeys(String sessionId) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.sessionKey(sessionId));
        sessionRepository.findById(sessionId)
                .ifPresent(s -> s.taskIds().forEach(id -> keys.add(KeyedLocks.taskKey(id))));
        taskRepository.findBySessionId(sessionId).forEach(t -> keys.add(KeyedLocks.taskKey(t.id())));
        return keys;
    }

    /**
     * Lock keys covering a task and every session linked to it from either side.
     */
    Set<String> taskLockKeys(String taskId) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.taskKey(taskId));
        taskRepository.findById(taskId)
                .ifPresent(t -> t.sessionIds().forEach(id -> keys.add(KeyedLocks.sessionKey(id))));
        sessionRepository.findByTaskId(taskId).forEach(s -> keys.add(KeyedLocks.sessionKey(s.id())));
        return keys;
    }

    Pair link(Session session, Task task, RecordBatch batch, Outbox outbox) {
        boolean taskSide = !task.hasSession(session.id());
        boolean sessionSide = !session.hasTask(task.id());
        if (!taskSide && !sessionSide) {
            return new Pair(session, task, false);
        }

        Task linkedTask = task;
        if (taskSide) {
            List<String> sessionIds = new ArrayList<>(task.sessionIds());
            sessionIds.add(session.id());
            linkedTask = task.toBuilder().sessionIds(sessionIds).build();
            batch.task(linkedTask);
        }
        Session linkedSession = session;
        if (sessionSide) {
            List<String> taskIds = new ArrayList<>(session.taskIds());
            taskIds.add(task.id());
            linkedSession = session.toBuilder().taskIds(taskIds).lastActivity(Instant.now()).build();
            batch.session(linkedSession);
        }

        DomainEvents.Link payload = new DomainEvents.Link(task.id(), session.id());
        outbox.add(DomainEvents.TASK_SESSION_ADDED, payload)
                .add(DomainEvents.SESSION_TASK_ADDED, payload)
                .add(DomainEvents.TASK_UPDATED, linkedTask)
                .add(DomainEvents.SESSION_UPDATED, linkedSession);
        return new Pair(linkedSession, linkedTask, true);
    }

    Pair unlink(Session session, Task task, RecordBatch batch, Outbox outbox) {
        boolean taskSide = task.hasSession(session.id());
        boolean sessionSide = session.hasTask(task.id());
        if (!taskSide && !sessionSide) {
            return new Pair(session, task, false);
        }

        Task unlinkedTask = task;
        if (taskSide) {
            unlinkedTask = withoutSession(task, session.id());
            batch.task(unlinkedTask);
        }
        Session unlinkedSession = session;
        if (sessionSide) {
            List<String> taskIds = new ArrayList<>(session.taskIds());
            taskIds.remove(task.id());
            unlinkedSession = session.toBuilder().taskIds(taskIds).lastActivity(Instant.now()).build();
            batch.session(unlinkedSession);
        }

        DomainEvents.Link payload = new DomainEvents.Link(task.id(), session.id());
        outbox.add(DomainEvents.TASK_SESSION_REMOVED, payload)
                .add(DomainEvents.SESSION_TASK_REMOVED, payload)
                .add(DomainEvents.TASK_UPDATED, unlinkedTask)
                .add(DomainEvents.SESSION_UPDATED, unlinkedSession);
        return new Pair(unlinkedSession, unlinkedTask, true);
    }

    /**
     * Remove a session being deleted from every task referencing it.
     *
     * @return the rewritten tasks
     */
    List<Task> releaseTasksOf(String sessionId, RecordBatch batch, Outbox outbox) {
        Map<String, Task> affected = new LinkedHashMap<>();
        sessionRepository.findById(sessionId).ifPresent(s -> s.taskIds()
                .forEach(id -> taskRepository.findById(id).ifPresent(t -> affected.put(t.id(), t))));
        taskRepository.findBySessionId(sessionId).forEach(t -> affected.putIfAbsent(t.id(), t));

        List<Task> updated = new ArrayList<>();
        for (Task task : affected.values()) {
            Task released = withoutSession(task, sessionId);
            if (!released.equals(task)) {
                batch.task(released);
                updated.add(released);
                outbox.add(DomainEvents.TASK_SESSION_REMOVED, new DomainEvents.Link(task.id(), sessionId))
                        .add(DomainEvents.TASK_UPDATED, released);
            }
        }
        return updated;
    }

    /**
     * Remove a task being deleted from every session referencing it.
     *
     * @return the rewritten sessions
     */
    List<Session> releaseSessionsOf(String taskId, RecordBatch batch, Outbox outbox) {
        Map<String, Session> affected = new LinkedHashMap<>();
        taskRepository.findById(taskId).ifPresent(t -> t.sessionIds()
                .forEach(id -> sessionRepository.findById(id).ifPresent(s -> affected.put(s.id(), s))));
        sessionRepository.findByTaskId(taskId).forEach(s -> affected.putIfAbsent(s.id(), s));

        Instant now = Instant.now();
        List<Session> updated = new ArrayList<>();
        for (Session session : affected.values()) {
            List<String> taskIds = new ArrayList<>(session.taskIds());
            taskIds.remove(taskId);
            if (taskIds.size() == session.taskIds().size()) {
                continue;
            }
            Session released = session.toBuilder().taskIds(taskIds).lastActivity(now).build();
            batch.session(released);
            updated.add(released);
            outbox.add(DomainEvents.SESSION_TASK_REMOVED, new DomainEvents.Link(taskId, session.id()))
                    .add(DomainEvents.SESSION_UPDATED, released);
        }
        return updated;
    }

    private static Task withoutSession(Task task, String sessionId) {
        List<String> sessionIds = new ArrayList<>(task.sessionIds());
        sessionIds.remove(sessionId);
        Map<String, TaskSessionStatus> statuses = new LinkedHashMap<>(task.taskSessionStatuses());
        statuses.remove(sessionId);
        return task.toBuilder().sessionIds(sessionIds).taskSessionStatuses(statuses).build();
    }

    private Session requireSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private Task requireTask(String taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    /** Both sides of a link after a link/unlink step. */
    record Pair(Session session, Task task, boolean changed) {
    }
}
