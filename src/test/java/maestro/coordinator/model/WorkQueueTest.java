package maestro.coordinator.model;

import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkQueueTest {

    private final Instant t0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void newQueueHasNoCursor() {
        WorkQueue queue = WorkQueue.create("sess_1", List.of("a", "b"), t0);

        assertEquals(WorkQueue.NO_CURRENT, queue.currentIndex());
        assertNull(queue.currentItem());
        assertEquals(0, queue.nextQueuedIndex());
        assertTrue(queue.hasPending("a"));
        assertFalse(queue.hasPending("c"));
    }

    @Test
    void claimMovesCursorAndNextSkipsClaimed() {
        WorkQueue queue = WorkQueue.create("sess_1", List.of("a", "b"), t0);
        QueueItem claimed = queue.items().get(0).claimed(t0.plusSeconds(1));

        WorkQueue next = queue.replace(0, claimed, 0, t0.plusSeconds(1));

        assertEquals("a", next.currentItem().taskId());
        assertEquals(1, next.nextQueuedIndex());
        assertEquals(1, next.count(QueueItemStatus.PROCESSING));
        assertEquals(QueueItemStatus.QUEUED, queue.items().get(0).status());
    }

    @Test
    void latestProcessingIndexPicksMostRecentClaim() {
        WorkQueue queue = WorkQueue.create("sess_1", List.of("a", "b", "c"), t0);
        queue = queue.replace(0, queue.items().get(0).claimed(t0.plusSeconds(1)), 0, t0);
        queue = queue.replace(1, queue.items().get(1).claimed(t0.plusSeconds(2)), 1, t0);

        assertEquals(1, queue.latestProcessingIndex(-1));
        assertEquals(0, queue.latestProcessingIndex(1));

        WorkQueue appended = queue.append(List.of("d"), t0.plusSeconds(3));
        assertEquals(4, appended.items().size());
        assertEquals(2, appended.nextQueuedIndex());
    }

    @Test
    void finishedItemIsNoLongerPending() {
        QueueItem item = QueueItem.queued("a", t0).claimed(t0);
        QueueItem failed = item.finished(QueueItemStatus.FAILED, t0.plusSeconds(5), "crash");

        assertEquals("crash", failed.failReason());
        assertEquals(t0, failed.startedAt());
        assertThrows(IllegalArgumentException.class, () -> item.finished(QueueItemStatus.QUEUED, t0, null));

        WorkQueue queue = new WorkQueue("s", List.of(failed), WorkQueue.NO_CURRENT, t0, t0);
        assertFalse(queue.hasPending("a"));
    }
}
