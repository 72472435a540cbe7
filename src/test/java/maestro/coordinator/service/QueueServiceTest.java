package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.ClaimResult;
import maestro.coordinator.model.QueueItem;
import maestro.coordinator.model.QueueItemStatus;
import maestro.coordinator.model.QueueStats;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TimelineEventType;
import maestro.coordinator.model.WorkQueue;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueueServiceTest {

    private Dependencies deps;
    private QueueService queues;
    private String projectId;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-queue-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withMaxClaimTimeout(Duration.ofSeconds(10));
        deps = Dependencies.create(config);
        queues = deps.queueService();
        projectId = deps.projectService().create("queue-project", "/tmp/q", null).id();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private String task(String title) {
        return deps.taskService().create(NewTask.of(projectId, title)).id();
    }

    private String queueSession(String... taskIds) {
        return deps.sessionService().create(NewSession.queue(projectId, List.of(taskIds))).id();
    }

    @Test
    @DisplayName("Items are claimed in insertion order across pushes")
    void claimsFollowInsertionOrder() {
        String a = task("a");
        String b = task("b");
        String c = task("c");
        String sessionId = queueSession();

        queues.push(sessionId, List.of(a, b));
        queues.push(sessionId, List.of(c));

        List<String> claimed = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            ClaimResult result = queues.claimNext(sessionId, Duration.ZERO);
            assertTrue(result.claimed());
            claimed.add(result.item().taskId());
            queues.complete(sessionId);
        }
        assertEquals(List.of(a, b, c), claimed);
        assertTrue(queues.claimNext(sessionId, Duration.ZERO).isNoWork());
    }

    @Test
    void claimMarksItemProcessingAndUpdatesTaskAndTimeline() {
        String a = task("a");
        String sessionId = queueSession(a);

        ClaimResult result = queues.claimNext(sessionId, Duration.ZERO);

        assertTrue(result.claimed());
        assertEquals(QueueItemStatus.PROCESSING, result.item().status());
        assertNotNull(result.item().startedAt());
        WorkQueue queue = queues.getQueue(sessionId);
        assertEquals(0, queue.currentIndex());
        assertEquals(TaskSessionStatus.WORKING, deps.taskService().get(a).sessionStatus(sessionId));
        Session session = deps.sessionService().get(sessionId);
        assertEquals(TimelineEventType.TASK_STARTED, session.timeline().get(session.timeline().size() - 1).type());
    }

    @Test
    @DisplayName("Two racing claims on one item: exactly one wins")
    void claimIsExclusive() throws Exception {
        String a = task("a");
        String sessionId = queueSession(a);

        CompletableFuture<ClaimResult> first = CompletableFuture.supplyAsync(
                () -> queues.claimNext(sessionId, Duration.ofMillis(300)));
        CompletableFuture<ClaimResult> second = CompletableFuture.supplyAsync(
                () -> queues.claimNext(sessionId, Duration.ofMillis(300)));

        List<ClaimResult> results = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
        assertEquals(1, results.stream().filter(ClaimResult::claimed).count());
        assertEquals(1, results.stream().filter(ClaimResult::isNoWork).count());
        assertEquals(1, queues.stats(sessionId).processing());
    }

    @Test
    @DisplayName("A waiting claim is woken by a push well before its timeout")
    void pushWakesWaitingClaim() throws Exception {
        String a = task("a");
        String sessionId = queueSession();

        long start = System.nanoTime();
        ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));
        assertFalse(pending.isDone());
        assertEquals(1, queues.waitingCount(sessionId));

        Thread.sleep(50);
        queues.push(sessionId, List.of(a));

        ClaimResult result = pending.get(2, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(result.claimed());
        assertEquals(a, result.item().taskId());
        assertTrue(elapsedMs < 2000, "woke after " + elapsedMs + " ms");
        assertEquals(0, queues.waitingCount(sessionId));
        assertEquals(QueueItemStatus.PROCESSING, queues.getQueue(sessionId).items().get(0).status());
    }

    @Test
    @DisplayName("Timeout returns no-work no earlier than requested")
    void timeoutReturnsNoWork() {
        String sessionId = queueSession();

        long start = System.nanoTime();
        ClaimResult result = queues.claimNext(sessionId, Duration.ofMillis(200));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(result.isNoWork());
        assertNull(result.item());
        assertEquals(sessionId, result.sessionId());
        assertTrue(elapsedMs >= 200, "returned after " + elapsedMs + " ms");
        assertTrue(elapsedMs < 1500, "returned after " + elapsedMs + " ms");
        assertEquals(0, queues.waitingCount(sessionId));
    }

    @Test
    @DisplayName("A timeout fires while the session's queue lock is held elsewhere")
    void timeoutDoesNotWaitForQueueLock() {
        String sessionId = queueSession();
        ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofMillis(100));

        ClaimResult result = deps.locks().withLock(KeyedLocks.queueKey(sessionId),
                () -> assertDoesNotThrow(() -> pending.get(2, TimeUnit.SECONDS)));

        assertTrue(result.isNoWork());
        assertEquals(0, queues.waitingCount(sessionId));
    }

    @Test
    void expiredWaitersAreNotServedByLaterPush() {
        String a = task("a");
        String sessionId = queueSession();
        assertTrue(queues.claimNext(sessionId, Duration.ofMillis(50)).isNoWork());

        ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));
        queues.push(sessionId, List.of(a));

        ClaimResult result = assertDoesNotThrow(() -> pending.get(2, TimeUnit.SECONDS));
        assertTrue(result.claimed());
        assertEquals(a, result.item().taskId());
        assertEquals(0, queues.waitingCount(sessionId));
    }

    @Test
    void cancelledWaitClaimsNothing() throws Exception {
        String a = task("a");
        String sessionId = queueSession();

        ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));
        assertTrue(pending.cancel(true));
        assertTrue(pending.isCancelled());
        assertEquals(0, queues.waitingCount(sessionId));

        queues.push(sessionId, List.of(a));
        assertEquals(QueueItemStatus.QUEUED, queues.getQueue(sessionId).items().get(0).status());
        assertTrue(queues.peek(sessionId).isPresent());
    }

    @Test
    void waitersAreServedInArrivalOrder() throws Exception {
        String a = task("a");
        String b = task("b");
        String sessionId = queueSession();

        ClaimFuture first = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));
        ClaimFuture second = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));
        queues.push(sessionId, List.of(a, b));

        assertEquals(a, first.get(2, TimeUnit.SECONDS).item().taskId());
        assertEquals(b, second.get(2, TimeUnit.SECONDS).item().taskId());
    }

    @Test
    void zeroTimeoutDoesNotWait() {
        String sessionId = queueSession();
        ClaimFuture result = queues.claimNextAsync(sessionId, Duration.ZERO);
        assertTrue(result.isDone());
        assertTrue(result.join().isNoWork());
    }

    @Test
    void timeoutIsCappedByConfiguredMaximum() {
        assertEquals(Duration.ofSeconds(10), queues.effectiveTimeout(Duration.ofHours(1)));
        assertEquals(Duration.ZERO, queues.effectiveTimeout(Duration.ofMillis(-5)));
        assertEquals(Duration.ZERO, queues.effectiveTimeout(null));
        assertEquals(Duration.ofMillis(250), queues.effectiveTimeout(Duration.ofMillis(250)));
    }

    @Nested
    class FinishingItems {

        @Test
        void completeWithoutClaimIsRejected() {
            String sessionId = queueSession(task("a"));
            assertThrows(ValidationException.class, () -> queues.complete(sessionId));
            assertThrows(ValidationException.class, () -> queues.skip(sessionId));
            assertThrows(ValidationException.class, () -> queues.fail(sessionId, "boom"));
        }

        @Test
        void failRecordsReasonAndSessionStatus() {
            String a = task("a");
            String sessionId = queueSession(a);
            queues.claimNext(sessionId, Duration.ZERO);

            QueueItem failed = queues.fail(sessionId, "compiler error");

            assertEquals(QueueItemStatus.FAILED, failed.status());
            assertEquals("compiler error", failed.failReason());
            assertNotNull(failed.completedAt());
            assertEquals(WorkQueue.NO_CURRENT, queues.getQueue(sessionId).currentIndex());
            assertEquals(TaskSessionStatus.FAILED, deps.taskService().get(a).sessionStatus(sessionId));
            Session session = deps.sessionService().get(sessionId);
            assertEquals(TimelineEventType.TASK_FAILED,
                    session.timeline().get(session.timeline().size() - 1).type());
        }

        @Test
        void cursorFallsBackToPreviousProcessingItem() {
            String a = task("a");
            String b = task("b");
            String sessionId = queueSession(a, b);
            queues.claimNext(sessionId, Duration.ZERO);
            queues.claimNext(sessionId, Duration.ZERO);

            QueueItem done = queues.complete(sessionId);

            assertEquals(b, done.taskId());
            assertEquals(a, queues.current(sessionId).orElseThrow().taskId());
            queues.skip(sessionId);
            assertTrue(queues.current(sessionId).isEmpty());

            QueueStats stats = queues.stats(sessionId);
            assertEquals(2, stats.total());
            assertEquals(1, stats.completed());
            assertEquals(1, stats.skipped());
        }
    }

    @Nested
    class Push {

        @Test
        void pushingPendingTaskTwiceIsRejected() {
            String a = task("a");
            String sessionId = queueSession(a);
            assertThrows(ValidationException.class, () -> queues.push(sessionId, List.of(a)));
        }

        @Test
        void finishedTaskMayBePushedAgain() {
            String a = task("a");
            String sessionId = queueSession(a);
            queues.claimNext(sessionId, Duration.ZERO);
            queues.complete(sessionId);

            WorkQueue queue = queues.push(sessionId, List.of(a));
            assertEquals(2, queue.items().size());
            assertEquals(QueueItemStatus.QUEUED, queue.items().get(1).status());
        }

        @Test
        void pushAttachesTaskToSession() {
            String a = task("a");
            String sessionId = queueSession();

            queues.push(sessionId, List.of(a));

            assertTrue(deps.sessionService().get(sessionId).hasTask(a));
            assertTrue(deps.taskService().get(a).hasSession(sessionId));
            assertEquals(TaskSessionStatus.QUEUED, deps.taskService().get(a).sessionStatus(sessionId));
        }

        @Test
        void pushRefreshesSessionActivity() throws Exception {
            String a = task("a");
            String sessionId = queueSession();
            Instant before = deps.sessionService().get(sessionId).lastActivity();

            Thread.sleep(20);
            queues.push(sessionId, List.of(a));

            Instant after = deps.sessionService().get(sessionId).lastActivity();
            assertTrue(after.isAfter(before), before + " -> " + after);
        }

        @Test
        void pushPublishesItemEvents() {
            String a = task("a");
            String sessionId = queueSession();
            List<Object> payloads = Collections.synchronizedList(new ArrayList<>());
            deps.eventBus().subscribe(DomainEvents.QUEUE_ITEM_PUSHED, e -> payloads.add(e.payload()));

            queues.push(sessionId, List.of(a));

            assertEquals(List.of(new DomainEvents.QueueItemChange(sessionId, a, null)), payloads);
        }

        @Test
        void unknownTaskOrQueueIsNotFound() {
            String sessionId = queueSession();
            assertThrows(NotFoundException.class, () -> queues.push(sessionId, List.of("task_missing")));
            assertThrows(NotFoundException.class, () -> queues.push("sess_missing", List.of(task("a"))));

            String simple = deps.sessionService().create(NewSession.of(projectId, List.of())).id();
            assertThrows(NotFoundException.class, () -> queues.claimNext(simple, Duration.ZERO));
        }
    }

    @Nested
    class SessionLifecycle {

        @Test
        void terminalSessionAcceptsNoWork() {
            String a = task("a");
            String sessionId = queueSession(a);
            deps.sessionService().updateStatus(sessionId, SessionStatus.STOPPED);

            assertThrows(BusinessRuleException.class, () -> queues.claimNext(sessionId, Duration.ZERO));
            assertThrows(BusinessRuleException.class, () -> queues.push(sessionId, List.of(task("b"))));
        }

        @Test
        void endingSessionReleasesWaiters() throws Exception {
            String sessionId = queueSession();
            ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));

            deps.sessionService().updateStatus(sessionId, SessionStatus.COMPLETED);

            assertTrue(pending.get(2, TimeUnit.SECONDS).isNoWork());
        }

        @Test
        void deletingSessionReleasesWaitersAndQueue() throws Exception {
            String sessionId = queueSession();
            ClaimFuture pending = queues.claimNextAsync(sessionId, Duration.ofSeconds(5));

            deps.sessionService().delete(sessionId);

            assertTrue(pending.get(2, TimeUnit.SECONDS).isNoWork());
            assertThrows(NotFoundException.class, () -> queues.getQueue(sessionId));
        }

        @Test
        void itemOfDeletedTaskIsSkippedOnClaim() {
            String a = task("a");
            String b = task("b");
            String sessionId = queueSession(a, b);
            deps.taskService().delete(a);

            ClaimResult result = queues.claimNext(sessionId, Duration.ZERO);

            assertEquals(b, result.item().taskId());
            QueueItem skipped = queues.getQueue(sessionId).items().get(0);
            assertEquals(QueueItemStatus.SKIPPED, skipped.status());
            assertEquals("task deleted", skipped.failReason());
        }
    }
}
