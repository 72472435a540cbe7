package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvent;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.Outbox;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.ClaimResult;
import maestro.coordinator.model.QueueItem;
import maestro.coordinator.model.QueueItemStatus;
import maestro.coordinator.model.QueueStats;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TimelineEvent;
import maestro.coordinator.model.TimelineEventType;
import maestro.coordinator.model.WorkQueue;
import maestro.coordinator.repository.QueueRepository;
import maestro.coordinator.repository.SessionRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.store.RecordBatch;
import maestro.coordinator.store.RecordStore;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Work queue engine: per-session FIFO of claimable task references.
 * <p>
 * Item states go {@code queued -> processing -> completed|failed|skipped}.
 * A claim against a queue without queued items parks a waiter instead of
 * polling; {@link #push} hands new items straight to parked waiters in
 * arrival order, and a timer completes the waiter with a "no work" result
 * when its timeout elapses. Waiters for one session live in a deque guarded
 * by that session's queue lock, and a waiter is only ever parked while the
 * queue has no queued item. Deques may hold already completed waiters; every
 * reader skips them.
 * <p>
 * Waiter futures may be completed while entity locks are held. Callers must
 * continue asynchronously (or block on the future from their own thread)
 * rather than call back into the coordinator from a synchronous continuation.
 */
public class QueueService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    static final String DELETED_TASK_REASON = "task deleted";

    private final QueueRepository queueRepository;
    private final TaskRepository taskRepository;
    private final SessionRepository sessionRepository;
    private final RecordStore store;
    private final RelationshipMaintainer relationships;
    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final Duration maxClaimTimeout;

    private final Map<String, ArrayDeque<Waiter>> waiters = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timer;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public QueueService(QueueRepository queueRepository, TaskRepository taskRepository,
            SessionRepository sessionRepository, RecordStore store, RelationshipMaintainer relationships,
            KeyedLocks locks, EventBus eventBus, IdGenerator idGenerator, Duration maxClaimTimeout) {
        this.queueRepository = queueRepository;
        this.taskRepository = taskRepository;
        this.sessionRepository = sessionRepository;
        this.store = store;
        this.relationships = relationships;
        this.locks = locks;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.maxClaimTimeout = maxClaimTimeout;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "maestro-claim-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Release parked claims of sessions that are deleted or become terminal.
     */
    public void registerHandlers() {
        subscriptions.add(eventBus.subscribe(DomainEvents.SESSION_DELETED, this::onSessionDeleted));
        subscriptions.add(eventBus.subscribe(DomainEvents.SESSION_UPDATED, this::onSessionUpdated));
    }

    private void onSessionDeleted(DomainEvent event) {
        if (event.payload() instanceof DomainEvents.Deleted deleted) {
            releaseWaiters(deleted.id());
        }
    }

    private void onSessionUpdated(DomainEvent event) {
        if (event.payload() instanceof Session session && session.isTerminal()) {
            releaseWaiters(session.id());
        }
    }

    // ========== Claim ==========

    /**
     * Claim the next queued item, waiting up to {@code timeout} for one to be pushed.
     * <p>
     * The returned future completes with the claimed item, or with
     * {@link ClaimResult#noWork} once the timeout elapses or the session ends.
     * Cancelling the future releases the waiter without claiming anything.
     *
     * @throws NotFoundException     if the session or its queue does not exist
     * @throws BusinessRuleException if the session is terminal
     */
    public ClaimFuture claimNextAsync(String sessionId, Duration timeout) {
        Duration wait = effectiveTimeout(timeout);
        Outbox outbox = new Outbox();
        ClaimFuture future = null;
        while (future == null) {
            future = locks.withResolvedLocks(() -> claimLockKeys(sessionId),
                    () -> tryClaim(sessionId, wait, outbox));
            outbox.publishTo(eventBus);
        }
        return future;
    }

    /**
     * Blocking form of {@link #claimNextAsync}. Interrupting the calling thread
     * cancels the wait.
     */
    public ClaimResult claimNext(String sessionId, Duration timeout) {
        ClaimFuture future = claimNextAsync(sessionId, timeout);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future.cancel(true)) {
                throw new CancellationException("Claim for session " + sessionId + " interrupted");
            }
            return future.join();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    /** Clamp a requested wait to {@code [0, maxClaimTimeout]}. Null means no wait. */
    Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isNegative() || requested.isZero()) {
            return Duration.ZERO;
        }
        return requested.compareTo(maxClaimTimeout) > 0 ? maxClaimTimeout : requested;
    }

    private Set<String> claimLockKeys(String sessionId) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.queueKey(sessionId));
        keys.add(KeyedLocks.sessionKey(sessionId));
        queueRepository.findBySessionId(sessionId).ifPresent(queue -> {
            int next = queue.nextQueuedIndex();
            if (next >= 0) {
                keys.add(KeyedLocks.taskKey(queue.items().get(next).taskId()));
            }
        });
        return keys;
    }

    /**
     * One claim attempt under the queue, session and next-task locks.
     *
     * @return the future to hand back, or null if a stale item was skipped and
     *         the claim should be retried with a fresh lock set
     */
    private ClaimFuture tryClaim(String sessionId, Duration wait, Outbox outbox) {
        Session session = requireSession(sessionId);
        WorkQueue queue = requireQueue(sessionId);
        requireOpen(session);

        int next = queue.nextQueuedIndex();
        if (next >= 0) {
            QueueItem item = queue.items().get(next);
            Optional<Task> task = taskRepository.findById(item.taskId());
            if (task.isEmpty()) {
                skipDeletedTask(queue, next, outbox);
                return null;
            }
            RecordBatch batch = RecordBatch.create();
            Assignment assignment = assign(queue, next, session, task.get(), Instant.now(), batch, outbox);
            store.commit(batch);
            outbox.add(DomainEvents.TASK_UPDATED, assignment.task())
                    .add(DomainEvents.SESSION_UPDATED, assignment.session());
            log.debug("Session {} claimed task {}", sessionId, item.taskId());
            return ClaimFuture.completed(ClaimResult.claimed(sessionId, assignment.item()));
        }

        if (wait.isZero()) {
            return ClaimFuture.completed(ClaimResult.noWork(sessionId));
        }
        return park(sessionId, wait);
    }

    private void skipDeletedTask(WorkQueue queue, int index, Outbox outbox) {
        QueueItem item = queue.items().get(index);
        Instant now = Instant.now();
        WorkQueue next = queue.replace(index, item.finished(QueueItemStatus.SKIPPED, now, DELETED_TASK_REASON),
                queue.currentIndex(), now);
        queueRepository.save(next);
        outbox.add(DomainEvents.QUEUE_ITEM_SKIPPED,
                new DomainEvents.QueueItemChange(queue.sessionId(), item.taskId(), DELETED_TASK_REASON));
        log.debug("Skipped queue item of deleted task {} in session {}", item.taskId(), queue.sessionId());
    }

    private ClaimFuture park(String sessionId, Duration wait) {
        ClaimFuture future = new ClaimFuture();
        Waiter waiter = new Waiter(sessionId, future);
        ArrayDeque<Waiter> deque = waiters.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
        deque.removeIf(w -> w.future.isDone());
        deque.addLast(waiter);
        waiter.timeout = timer.schedule(() -> expire(waiter), wait.toNanos(), TimeUnit.NANOSECONDS);
        future.onCancel(() -> {
            waiter.timeout.cancel(false);
            locks.withLock(KeyedLocks.queueKey(sessionId), () -> removeWaiter(waiter));
            log.debug("Claim wait for session {} cancelled", sessionId);
        });
        log.debug("Session {} waiting up to {} ms for work", sessionId, wait.toMillis());
        return future;
    }

    /**
     * Runs on the timer thread and takes no lock. The expired waiter stays in
     * its deque until the next park or push on that session drops it.
     */
    private void expire(Waiter waiter) {
        if (waiter.future.reserve()) {
            waiter.future.complete(ClaimResult.noWork(waiter.sessionId));
        }
    }

    private boolean removeWaiter(Waiter waiter) {
        ArrayDeque<Waiter> deque = waiters.get(waiter.sessionId);
        if (deque == null) {
            return false;
        }
        boolean removed = deque.remove(waiter);
        if (deque.isEmpty()) {
            waiters.remove(waiter.sessionId);
        }
        return removed;
    }

    /**
     * Complete every parked claim of a session with "no work".
     */
    void releaseWaiters(String sessionId) {
        int released = locks.withLock(KeyedLocks.queueKey(sessionId), () -> {
            ArrayDeque<Waiter> deque = waiters.remove(sessionId);
            if (deque == null) {
                return 0;
            }
            int count = 0;
            for (Waiter waiter : deque) {
                waiter.timeout.cancel(false);
                if (waiter.future.reserve()) {
                    waiter.future.complete(ClaimResult.noWork(sessionId));
                    count++;
                }
            }
            return count;
        });
        if (released > 0) {
            log.debug("Released {} waiting claim(s) of session {}", released, sessionId);
        }
    }

    /** Number of claims currently parked on a session's queue. */
    public int waitingCount(String sessionId) {
        return locks.withLock(KeyedLocks.queueKey(sessionId), () -> {
            ArrayDeque<Waiter> deque = waiters.get(sessionId);
            return deque == null ? 0 : (int) deque.stream().filter(w -> !w.future.isDone()).count();
        });
    }

    // ========== Push ==========

    /**
     * Append tasks to the end of a session's queue and attach them to the session.
     * Parked claims are served first, in arrival order.
     *
     * @return the queue after the push and any hand-offs
     * @throws ValidationException   if a task is listed twice or is already queued or processing
     * @throws NotFoundException     if the session, its queue or a task does not exist
     * @throws BusinessRuleException if the session is terminal
     */
    public WorkQueue push(String sessionId, List<String> taskIds) {
        if (taskIds == null || taskIds.isEmpty()) {
            throw new ValidationException("At least one task ID is required");
        }
        Set<String> unique = new HashSet<>();
        for (String taskId : taskIds) {
            if (taskId == null || taskId.isBlank()) {
                throw new ValidationException("Task ID cannot be empty");
            }
            if (!unique.add(taskId)) {
                throw new ValidationException(String.format("Task '%s' is listed more than once", taskId));
            }
        }

        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.queueKey(sessionId));
        keys.add(KeyedLocks.sessionKey(sessionId));
        taskIds.forEach(id -> keys.add(KeyedLocks.taskKey(id)));

        Outbox outbox = new Outbox();
        List<Handoff> handoffs = new ArrayList<>();
        WorkQueue result = locks.withLocks(keys, () -> {
            Session session = requireSession(sessionId);
            WorkQueue queue = requireQueue(sessionId);
            requireOpen(session);

            Map<String, Task> tasks = new LinkedHashMap<>();
            for (String taskId : taskIds) {
                Task task = taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
                if (queue.hasPending(taskId)) {
                    throw new ValidationException(String.format(
                            "Task '%s' is already queued or processing in session '%s'", taskId, sessionId));
                }
                tasks.put(taskId, task);
            }

            Instant now = Instant.now();
            RecordBatch batch = RecordBatch.create();
            WorkQueue pushed = queue.append(taskIds, now);
            for (Task task : new ArrayList<>(tasks.values())) {
                RelationshipMaintainer.Pair pair = relationships.link(session, task, batch, new Outbox());
                session = pair.session();
                if (pair.changed()) {
                    DomainEvents.Link link = new DomainEvents.Link(task.id(), sessionId);
                    outbox.add(DomainEvents.TASK_SESSION_ADDED, link)
                            .add(DomainEvents.SESSION_TASK_ADDED, link);
                }
                Task queued = SessionService.withSessionStatus(pair.task(), sessionId, TaskSessionStatus.QUEUED, now);
                tasks.put(task.id(), queued);
                batch.task(queued);
                outbox.add(DomainEvents.QUEUE_ITEM_PUSHED,
                        new DomainEvents.QueueItemChange(sessionId, task.id(), null));
            }
            session = session.toBuilder().lastActivity(now).build();
            batch.session(session);
            batch.queue(pushed);

            // Serve parked claims in arrival order while queued items remain.
            ArrayDeque<Waiter> deque = waiters.get(sessionId);
            while (deque != null && !deque.isEmpty() && pushed.nextQueuedIndex() >= 0) {
                Waiter waiter = deque.pollFirst();
                if (!waiter.future.reserve()) {
                    continue;
                }
                waiter.timeout.cancel(false);
                int index = pushed.nextQueuedIndex();
                Task task = tasks.get(pushed.items().get(index).taskId());
                Assignment assignment = assign(pushed, index, session, task, now, batch, outbox);
                pushed = assignment.queue();
                session = assignment.session();
                tasks.put(task.id(), assignment.task());
                handoffs.add(new Handoff(waiter.future, ClaimResult.claimed(sessionId, assignment.item())));
            }
            if (deque != null && deque.isEmpty()) {
                waiters.remove(sessionId);
            }

            try {
                store.commit(batch);
            } catch (RuntimeException e) {
                handoffs.forEach(h -> h.future().completeExceptionally(e));
                handoffs.clear();
                throw e;
            }
            tasks.values().forEach(t -> outbox.add(DomainEvents.TASK_UPDATED, t));
            outbox.add(DomainEvents.SESSION_UPDATED, session);
            handoffs.forEach(h -> h.future().complete(h.result()));
            return pushed;
        });
        outbox.publishTo(eventBus);
        log.info("Pushed {} task(s) to session {}, {} handed to waiting claims",
                taskIds.size(), sessionId, handoffs.size());
        return result;
    }

    // ========== Complete / fail / skip ==========

    /**
     * Mark the currently claimed item completed.
     *
     * @throws ValidationException if no item is claimed
     */
    public QueueItem complete(String sessionId) {
        return finish(sessionId, QueueItemStatus.COMPLETED, null);
    }

    /**
     * Mark the currently claimed item failed with a reason.
     *
     * @throws ValidationException if no item is claimed
     */
    public QueueItem fail(String sessionId, String reason) {
        return finish(sessionId, QueueItemStatus.FAILED, reason);
    }

    /**
     * Mark the currently claimed item skipped.
     *
     * @throws ValidationException if no item is claimed
     */
    public QueueItem skip(String sessionId) {
        return finish(sessionId, QueueItemStatus.SKIPPED, null);
    }

    private QueueItem finish(String sessionId, QueueItemStatus terminal, String reason) {
        Outbox outbox = new Outbox();
        QueueItem finished = locks.withResolvedLocks(() -> finishLockKeys(sessionId), () -> {
            Session session = requireSession(sessionId);
            WorkQueue queue = requireQueue(sessionId);
            QueueItem current = queue.currentItem();
            if (current == null) {
                throw new ValidationException(String.format(
                        "No item is currently being processed in session '%s'", sessionId));
            }

            Instant now = Instant.now();
            int index = queue.currentIndex();
            QueueItem done = current.finished(terminal, now, reason);
            WorkQueue next = queue.replace(index, done, queue.latestProcessingIndex(index), now);

            RecordBatch batch = RecordBatch.create();
            batch.queue(next);
            Optional<Task> task = taskRepository.findById(current.taskId());
            if (task.isPresent() && task.get().hasSession(sessionId)) {
                Task updated = SessionService.withSessionStatus(task.get(), sessionId, sessionStatusFor(terminal), now);
                batch.task(updated);
                outbox.add(DomainEvents.TASK_UPDATED, updated);
            }
            Session updatedSession = session.append(timelineEvent(timelineTypeFor(terminal), now,
                    timelineMessage(terminal, reason), current.taskId()));
            batch.session(updatedSession);
            store.commit(batch);

            outbox.add(itemEventFor(terminal), new DomainEvents.QueueItemChange(sessionId, current.taskId(), reason))
                    .add(DomainEvents.SESSION_UPDATED, updatedSession);
            return done;
        });
        outbox.publishTo(eventBus);
        log.info("Session {} {} task {}", sessionId, terminal.wireName(), finished.taskId());
        return finished;
    }

    private Set<String> finishLockKeys(String sessionId) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.queueKey(sessionId));
        keys.add(KeyedLocks.sessionKey(sessionId));
        queueRepository.findBySessionId(sessionId).ifPresent(queue -> {
            QueueItem current = queue.currentItem();
            if (current != null) {
                keys.add(KeyedLocks.taskKey(current.taskId()));
            }
        });
        return keys;
    }

    // ========== Queries ==========

    public WorkQueue getQueue(String sessionId) {
        return requireQueue(sessionId);
    }

    public List<WorkQueue> listQueues() {
        return queueRepository.findAll();
    }

    /** The next item a claim would receive. */
    public Optional<QueueItem> peek(String sessionId) {
        WorkQueue queue = requireQueue(sessionId);
        int next = queue.nextQueuedIndex();
        return next < 0 ? Optional.empty() : Optional.of(queue.items().get(next));
    }

    /** The item under the cursor, if it is still processing. */
    public Optional<QueueItem> current(String sessionId) {
        return Optional.ofNullable(requireQueue(sessionId).currentItem());
    }

    public QueueStats stats(String sessionId) {
        return QueueStats.of(requireQueue(sessionId));
    }

    // ========== Helpers ==========

    /**
     * Move one queued item to processing, including its task's per-session
     * status and the session timeline. Records are added to the batch; the
     * caller publishes the record updates.
     */
    private Assignment assign(WorkQueue queue, int index, Session session, Task task, Instant now,
            RecordBatch batch, Outbox outbox) {
        QueueItem claimed = queue.items().get(index).claimed(now);
        WorkQueue next = queue.replace(index, claimed, index, now);
        Task working = SessionService.withSessionStatus(task, session.id(), TaskSessionStatus.WORKING, now);
        Session updated = session.append(timelineEvent(TimelineEventType.TASK_STARTED, now,
                "Claimed task from queue", task.id()));
        batch.queue(next).task(working).session(updated);

        outbox.add(DomainEvents.QUEUE_ITEM_CLAIMED, new DomainEvents.QueueItemChange(session.id(), task.id(), null));
        return new Assignment(next, updated, working, claimed);
    }

    private Session requireSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private WorkQueue requireQueue(String sessionId) {
        return queueRepository.findBySessionId(sessionId)
                .orElseThrow(() -> new NotFoundException("Queue", sessionId));
    }

    private static void requireOpen(Session session) {
        if (session.isTerminal()) {
            throw new BusinessRuleException(String.format("Session '%s' is %s and accepts no more work",
                    session.id(), session.status().wireName()));
        }
    }

    private TimelineEvent timelineEvent(TimelineEventType type, Instant at, String message, String taskId) {
        return new TimelineEvent(idGenerator.generate("evt"), type, at, message, taskId);
    }

    private static TaskSessionStatus sessionStatusFor(QueueItemStatus terminal) {
        switch (terminal) {
            case COMPLETED:
                return TaskSessionStatus.COMPLETED;
            case FAILED:
                return TaskSessionStatus.FAILED;
            default:
                return TaskSessionStatus.SKIPPED;
        }
    }

    private static TimelineEventType timelineTypeFor(QueueItemStatus terminal) {
        switch (terminal) {
            case COMPLETED:
                return TimelineEventType.TASK_COMPLETED;
            case FAILED:
                return TimelineEventType.TASK_FAILED;
            default:
                return TimelineEventType.TASK_SKIPPED;
        }
    }

    private static String timelineMessage(QueueItemStatus terminal, String reason) {
        switch (terminal) {
            case COMPLETED:
                return "Completed queue item";
            case FAILED:
                return reason != null ? "Failed queue item: " + reason : "Failed queue item";
            default:
                return "Skipped queue item";
        }
    }

    private static String itemEventFor(QueueItemStatus terminal) {
        switch (terminal) {
            case COMPLETED:
                return DomainEvents.QUEUE_ITEM_COMPLETED;
            case FAILED:
                return DomainEvents.QUEUE_ITEM_FAILED;
            default:
                return DomainEvents.QUEUE_ITEM_SKIPPED;
        }
    }

    @Override
    public void close() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
        for (String sessionId : new ArrayList<>(waiters.keySet())) {
            releaseWaiters(sessionId);
        }
        timer.shutdownNow();
    }

    private static final class Waiter {
        private final String sessionId;
        private final ClaimFuture future;
        private volatile ScheduledFuture<?> timeout;

        private Waiter(String sessionId, ClaimFuture future) {
            this.sessionId = sessionId;
            this.future = future;
        }
    }

    private record Assignment(WorkQueue queue, Session session, Task task, QueueItem item) {
    }

    private record Handoff(ClaimFuture future, ClaimResult result) {
    }
}
