package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.Outbox;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.NeedsInput;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.model.SessionStrategy;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TimelineEvent;
import maestro.coordinator.model.TimelineEventType;
import maestro.coordinator.model.WorkQueue;
import maestro.coordinator.repository.ProjectRepository;
import maestro.coordinator.repository.QueueRepository;
import maestro.coordinator.repository.SessionRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.store.RecordBatch;
import maestro.coordinator.store.RecordKind;
import maestro.coordinator.store.RecordStore;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service layer for worker sessions.
 * <p>
 * A session starts {@code spawning}. Terminal statuses are irreversible; a
 * repeated terminal update returns the stored record unchanged. Every
 * mutation refreshes {@code lastActivity}; the timeline only grows.
 */
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessionRepository;
    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final QueueRepository queueRepository;
    private final RecordStore store;
    private final RelationshipMaintainer relationships;
    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;

    public SessionService(SessionRepository sessionRepository, TaskRepository taskRepository,
            ProjectRepository projectRepository, QueueRepository queueRepository, RecordStore store,
            RelationshipMaintainer relationships, KeyedLocks locks, EventBus eventBus, IdGenerator idGenerator) {
        this.sessionRepository = sessionRepository;
        this.taskRepository = taskRepository;
        this.projectRepository = projectRepository;
        this.queueRepository = queueRepository;
        this.store = store;
        this.relationships = relationships;
        this.locks = locks;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    // ========== Create / read ==========

    /**
     * Create a session in {@code spawning} status, attached to the given tasks.
     * A queue-strategy session also gets a work queue holding those tasks.
     */
    public Session create(NewSession input) {
        if (input.projectId() == null || input.projectId().isBlank()) {
            throw new ValidationException("Project ID is required");
        }
        List<String> taskIds = input.taskIds() == null ? List.of()
                : List.copyOf(new LinkedHashSet<>(input.taskIds()));
        SessionStrategy strategy = input.strategy() != null ? input.strategy() : SessionStrategy.SIMPLE;
        String sessionId = idGenerator.generate("sess");

        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.projectKey(input.projectId()));
        keys.add(KeyedLocks.sessionKey(sessionId));
        keys.add(KeyedLocks.queueKey(sessionId));
        taskIds.forEach(id -> keys.add(KeyedLocks.taskKey(id)));

        Outbox outbox = new Outbox();
        Session created = locks.withLocks(keys, () -> {
            projectRepository.findById(input.projectId())
                    .orElseThrow(() -> new NotFoundException("Project", input.projectId()));
            List<Task> tasks = new ArrayList<>();
            for (String taskId : taskIds) {
                tasks.add(taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId)));
            }

            Instant now = Instant.now();
            Session session = Session.builder()
                    .id(sessionId)
                    .projectId(input.projectId())
                    .name(input.name())
                    .status(SessionStatus.SPAWNING)
                    .strategy(strategy)
                    .env(input.env())
                    .metadata(input.metadata())
                    .startedAt(now)
                    .lastActivity(now)
                    .build()
                    .append(timelineEvent(TimelineEventType.SESSION_STARTED, now, "Session started", null));

            RecordBatch batch = RecordBatch.create();
            TaskSessionStatus initial = strategy == SessionStrategy.QUEUE
                    ? TaskSessionStatus.QUEUED
                    : TaskSessionStatus.WORKING;
            List<Task> linkedTasks = new ArrayList<>();
            for (Task task : tasks) {
                RelationshipMaintainer.Pair pair = relationships.link(session, task, batch, new Outbox());
                Task linked = withSessionStatus(pair.task(), sessionId, initial, now);
                batch.task(linked);
                linkedTasks.add(linked);
                session = pair.session().append(timelineEvent(TimelineEventType.TASK_STARTED, now,
                        "Started working on task", task.id()));
            }
            batch.session(session);

            WorkQueue queue = null;
            if (strategy == SessionStrategy.QUEUE) {
                queue = WorkQueue.create(sessionId, taskIds, now);
                batch.queue(queue);
            }
            store.commit(batch);

            outbox.add(DomainEvents.SESSION_CREATED, session);
            for (Task task : linkedTasks) {
                DomainEvents.Link link = new DomainEvents.Link(task.id(), sessionId);
                outbox.add(DomainEvents.TASK_SESSION_ADDED, link)
                        .add(DomainEvents.SESSION_TASK_ADDED, link)
                        .add(DomainEvents.TASK_UPDATED, task);
            }
            if (queue != null) {
                outbox.add(DomainEvents.QUEUE_CREATED, queue);
            }
            return session;
        });
        outbox.publishTo(eventBus);
        log.info("Created session {} ({}) with {} task(s)", created.id(), strategy.wireName(), taskIds.size());
        return created;
    }

    public Session get(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    /**
     * List sessions, optionally filtered. Null filters match everything.
     */
    public List<Session> list(String projectId, String taskId, SessionStatus status) {
        List<Session> sessions = projectId != null ? sessionRepository.findByProjectId(projectId)
                : taskId != null ? sessionRepository.findByTaskId(taskId)
                        : sessionRepository.findAll();
        return sessions.stream()
                .filter(s -> taskId == null || s.hasTask(taskId))
                .filter(s -> status == null || s.status() == status)
                .collect(Collectors.toList());
    }

    public int count() {
        return sessionRepository.count();
    }

    /** Sessions that are idle or working. */
    public int countRunning() {
        return sessionRepository.findByStatus(SessionStatus.IDLE).size()
                + sessionRepository.findByStatus(SessionStatus.WORKING).size();
    }

    // ========== Status and attributes ==========

    public Session updateStatus(String sessionId, SessionStatus status) {
        return update(sessionId, SessionUpdate.status(status));
    }

    /**
     * Apply a partial update.
     * <p>
     * Once terminal, a session keeps its status: another terminal status is
     * ignored (so a second "complete" returns the stored record), a
     * non-terminal one is rejected. Entering a terminal status stamps
     * {@code completedAt} and closes the session's still-active task statuses.
     */
    public Session update(String sessionId, SessionUpdate update) {
        if (update.name() != null && update.name().isBlank()) {
            throw new ValidationException("Session name cannot be empty");
        }
        Outbox outbox = new Outbox();
        Session result = locks.withResolvedLocks(() -> relationships.sessionLockKeys(sessionId), () -> {
            Session current = get(sessionId);
            SessionStatus target = update.status();
            if (target != null && current.isTerminal()) {
                if (!target.isTerminal()) {
                    throw new ValidationException(String.format("Session '%s' is already %s",
                            sessionId, current.status().wireName()));
                }
                target = null;
            }
            if (target == current.status()) {
                target = null;
            }

            Session.Builder next = current.toBuilder();
            boolean changed = false;
            if (update.name() != null && !update.name().trim().equals(current.name())) {
                next.name(update.name().trim());
                changed = true;
            }
            if (update.env() != null && !update.env().isEmpty()) {
                Map<String, String> env = new LinkedHashMap<>(current.env());
                env.putAll(update.env());
                changed |= !env.equals(current.env());
                next.env(env);
            }
            if (update.metadata() != null && !update.metadata().isEmpty()) {
                Map<String, String> metadata = new LinkedHashMap<>(current.metadata());
                metadata.putAll(update.metadata());
                changed |= !metadata.equals(current.metadata());
                next.metadata(metadata);
            }

            Instant now = Instant.now();
            RecordBatch batch = RecordBatch.create();
            if (target != null) {
                next.status(target);
                changed = true;
                if (target.isTerminal()) {
                    next.completedAt(now);
                    closeTaskStatuses(current, target, now, batch, outbox);
                }
            }
            if (!changed) {
                return current;
            }

            Session updated = next.lastActivity(now).build();
            batch.session(updated);
            store.commit(batch);

            outbox.add(DomainEvents.SESSION_UPDATED, updated);
            if (target == SessionStatus.COMPLETED) {
                outbox.add(DomainEvents.NOTIFY_SESSION_COMPLETED, notification(updated, "Session completed"));
            } else if (target == SessionStatus.FAILED) {
                outbox.add(DomainEvents.NOTIFY_SESSION_FAILED, notification(updated, "Session failed"));
            }
            return updated;
        });
        outbox.publishTo(eventBus);
        log.debug("Session {} updated, status {}", sessionId, result.status().wireName());
        return result;
    }

    private void closeTaskStatuses(Session session, SessionStatus terminal, Instant now, RecordBatch batch,
            Outbox outbox) {
        TaskSessionStatus closed = terminal == SessionStatus.COMPLETED
                ? TaskSessionStatus.COMPLETED
                : TaskSessionStatus.FAILED;
        for (String taskId : session.taskIds()) {
            Task task = taskRepository.findById(taskId).orElse(null);
            if (task == null) {
                continue;
            }
            TaskSessionStatus current = task.sessionStatus(session.id());
            if (current != null && current.isActive()) {
                Task updated = withSessionStatus(task, session.id(), closed, now);
                batch.task(updated);
                outbox.add(DomainEvents.TASK_UPDATED, updated);
            }
        }
    }

    // ========== Timeline and needs-input ==========

    /**
     * Append a timeline entry whose type is given by its wire name.
     *
     * @throws ValidationException if the type is unknown
     */
    public Session appendTimeline(String sessionId, String type, String message, String taskId) {
        return appendTimeline(sessionId, TimelineEventType.fromWire(type), message, taskId);
    }

    /**
     * Append a timeline entry. A {@code needs_input} entry also raises the
     * session's needs-input flag.
     */
    public Session appendTimeline(String sessionId, TimelineEventType type, String message, String taskId) {
        if (type == null) {
            throw new ValidationException("Timeline event type is required");
        }
        Outbox outbox = new Outbox();
        Session result = locks.withLock(KeyedLocks.sessionKey(sessionId), () -> {
            Session current = get(sessionId);
            Instant now = Instant.now();
            Session updated = current.append(timelineEvent(type, now, message, taskId));
            if (type == TimelineEventType.NEEDS_INPUT) {
                updated = updated.toBuilder().needsInput(NeedsInput.raised(message, now)).build();
            }
            sessionRepository.save(updated);

            outbox.add(DomainEvents.SESSION_UPDATED, updated);
            if (type == TimelineEventType.PROGRESS) {
                outbox.add(DomainEvents.NOTIFY_PROGRESS,
                        new DomainEvents.Notification(taskId, sessionId, updated.name(), message));
            } else if (type == TimelineEventType.NEEDS_INPUT) {
                outbox.add(DomainEvents.NOTIFY_NEEDS_INPUT,
                        new DomainEvents.Notification(taskId, sessionId, updated.name(), message));
            }
            return updated;
        });
        outbox.publishTo(eventBus);
        log.debug("Session {} timeline += {}", sessionId, type.wireName());
        return result;
    }

    public Session raiseNeedsInput(String sessionId, String message) {
        Outbox outbox = new Outbox();
        Session result = locks.withLock(KeyedLocks.sessionKey(sessionId), () -> {
            Session current = get(sessionId);
            Instant now = Instant.now();
            Session updated = current.toBuilder()
                    .needsInput(NeedsInput.raised(message, now))
                    .lastActivity(now)
                    .build();
            sessionRepository.save(updated);
            outbox.add(DomainEvents.SESSION_UPDATED, updated);
            if (!current.isWaitingForInput()) {
                outbox.add(DomainEvents.NOTIFY_NEEDS_INPUT,
                        new DomainEvents.Notification(null, sessionId, updated.name(), message));
            }
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    public Session clearNeedsInput(String sessionId) {
        Outbox outbox = new Outbox();
        Session result = locks.withLock(KeyedLocks.sessionKey(sessionId), () -> {
            Session current = get(sessionId);
            Session updated = current.toBuilder()
                    .needsInput(NeedsInput.cleared())
                    .lastActivity(Instant.now())
                    .build();
            sessionRepository.save(updated);
            outbox.add(DomainEvents.SESSION_UPDATED, updated);
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    // ========== Task links ==========

    /**
     * Attach a task to a running session and record it on the timeline.
     * Attaching an already attached task returns the session unchanged.
     *
     * @throws BusinessRuleException if the session is terminal
     */
    public Session addTask(String sessionId, String taskId) {
        Outbox outbox = new Outbox();
        Session result = locks.withLocks(List.of(KeyedLocks.sessionKey(sessionId), KeyedLocks.taskKey(taskId)),
                () -> {
                    Session session = get(sessionId);
                    Task task = taskRepository.findById(taskId)
                            .orElseThrow(() -> new NotFoundException("Task", taskId));
                    if (session.isTerminal()) {
                        throw new BusinessRuleException(String.format(
                                "Cannot add tasks to %s session '%s'", session.status().wireName(), sessionId));
                    }
                    RecordBatch batch = RecordBatch.create();
                    RelationshipMaintainer.Pair pair = relationships.link(session, task, batch, new Outbox());
                    if (!pair.changed()) {
                        return session;
                    }
                    Instant now = Instant.now();
                    Task linked = pair.task();
                    if (session.strategy() == SessionStrategy.SIMPLE) {
                        linked = withSessionStatus(linked, sessionId, TaskSessionStatus.WORKING, now);
                        batch.task(linked);
                    }
                    Session updated = pair.session().append(timelineEvent(TimelineEventType.TASK_STARTED, now,
                            "Added task to session", taskId));
                    batch.session(updated);
                    store.commit(batch);

                    DomainEvents.Link link = new DomainEvents.Link(taskId, sessionId);
                    outbox.add(DomainEvents.SESSION_TASK_ADDED, link)
                            .add(DomainEvents.TASK_SESSION_ADDED, link)
                            .add(DomainEvents.TASK_UPDATED, linked)
                            .add(DomainEvents.SESSION_UPDATED, updated);
                    return updated;
                });
        outbox.publishTo(eventBus);
        return result;
    }

    /**
     * Detach a task from a session. Detaching a task that is not attached is a no-op.
     */
    public Session removeTask(String sessionId, String taskId) {
        Outbox outbox = new Outbox();
        Session result = locks.withLocks(List.of(KeyedLocks.sessionKey(sessionId), KeyedLocks.taskKey(taskId)),
                () -> {
                    Session session = get(sessionId);
                    Task task = taskRepository.findById(taskId)
                            .orElseThrow(() -> new NotFoundException("Task", taskId));
                    RecordBatch batch = RecordBatch.create();
                    RelationshipMaintainer.Pair pair = relationships.unlink(session, task, batch, new Outbox());
                    if (!pair.changed()) {
                        return session;
                    }
                    Session updated = pair.session().toBuilder().lastActivity(Instant.now()).build();
                    batch.session(updated);
                    store.commit(batch);

                    DomainEvents.Link link = new DomainEvents.Link(taskId, sessionId);
                    outbox.add(DomainEvents.SESSION_TASK_REMOVED, link)
                            .add(DomainEvents.TASK_SESSION_REMOVED, link)
                            .add(DomainEvents.TASK_UPDATED, pair.task())
                            .add(DomainEvents.SESSION_UPDATED, updated);
                    return updated;
                });
        outbox.publishTo(eventBus);
        return result;
    }

    // ========== Delete ==========

    /**
     * Delete a session, detaching it from all of its tasks and removing its queue.
     */
    public void delete(String sessionId) {
        Outbox outbox = new Outbox();
        locks.withResolvedLocks(() -> {
            Set<String> keys = new LinkedHashSet<>(relationships.sessionLockKeys(sessionId));
            keys.add(KeyedLocks.queueKey(sessionId));
            return keys;
        }, () -> {
            get(sessionId);
            RecordBatch batch = RecordBatch.create();
            relationships.releaseTasksOf(sessionId, batch, outbox);
            batch.delete(RecordKind.SESSION, sessionId);
            boolean hadQueue = queueRepository.findBySessionId(sessionId).isPresent();
            if (hadQueue) {
                batch.delete(RecordKind.QUEUE, sessionId);
            }
            store.commit(batch);

            outbox.add(DomainEvents.SESSION_DELETED, new DomainEvents.Deleted(sessionId));
            if (hadQueue) {
                outbox.add(DomainEvents.QUEUE_DELETED, new DomainEvents.Deleted(sessionId));
            }
            return null;
        });
        outbox.publishTo(eventBus);
        log.info("Deleted session {}", sessionId);
    }

    // ========== Helpers ==========

    private TimelineEvent timelineEvent(TimelineEventType type, Instant at, String message, String taskId) {
        return new TimelineEvent(idGenerator.generate("evt"), type, at, message, taskId);
    }

    static Task withSessionStatus(Task task, String sessionId, TaskSessionStatus status, Instant now) {
        Map<String, TaskSessionStatus> statuses = new LinkedHashMap<>(task.taskSessionStatuses());
        statuses.put(sessionId, status);
        return task.toBuilder().taskSessionStatuses(statuses).updatedAt(now).build();
    }

    private static DomainEvents.Notification notification(Session session, String message) {
        return new DomainEvents.Notification(null, session.id(), session.name(), message);
    }
}
