package maestro.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of queue items belonging to one session, plus the cursor of the
 * most recently claimed item ({@code -1} when nothing is claimed).
 * Immutable; every transition returns a new instance.
 */
public record WorkQueue(
        String sessionId,
        List<QueueItem> items,
        int currentIndex,
        Instant createdAt,
        Instant updatedAt) {

    public static final int NO_CURRENT = -1;

    public WorkQueue {
        Objects.requireNonNull(sessionId, "sessionId is required");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static WorkQueue create(String sessionId, List<String> taskIds, Instant now) {
        List<QueueItem> items = new ArrayList<>();
        for (String taskId : taskIds) {
            items.add(QueueItem.queued(taskId, now));
        }
        return new WorkQueue(sessionId, items, NO_CURRENT, now, now);
    }

    /** Index of the first {@code queued} item, or -1. */
    public int nextQueuedIndex() {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).status() == QueueItemStatus.QUEUED) {
                return i;
            }
        }
        return -1;
    }

    /** The item under the cursor if it is still being processed. */
    public QueueItem currentItem() {
        if (currentIndex < 0 || currentIndex >= items.size()) {
            return null;
        }
        QueueItem item = items.get(currentIndex);
        return item.status() == QueueItemStatus.PROCESSING ? item : null;
    }

    /** True when the task has a queued or processing item in this queue. */
    public boolean hasPending(String taskId) {
        for (QueueItem item : items) {
            if (item.taskId().equals(taskId) && !item.status().isTerminal()) {
                return true;
            }
        }
        return false;
    }

    public WorkQueue append(List<String> taskIds, Instant now) {
        List<QueueItem> next = new ArrayList<>(items);
        for (String taskId : taskIds) {
            next.add(QueueItem.queued(taskId, now));
        }
        return new WorkQueue(sessionId, next, currentIndex, createdAt, now);
    }

    public WorkQueue replace(int index, QueueItem item, int newCurrentIndex, Instant now) {
        List<QueueItem> next = new ArrayList<>(items);
        next.set(index, item);
        return new WorkQueue(sessionId, next, newCurrentIndex, createdAt, now);
    }

    /** Latest claimed item (highest startedAt) that is still processing, or -1. */
    public int latestProcessingIndex(int excluding) {
        int best = NO_CURRENT;
        for (int i = 0; i < items.size(); i++) {
            QueueItem item = items.get(i);
            if (i == excluding || item.status() != QueueItemStatus.PROCESSING) {
                continue;
            }
            if (best == NO_CURRENT || item.startedAt().isAfter(items.get(best).startedAt())) {
                best = i;
            }
        }
        return best;
    }

    public long count(QueueItemStatus status) {
        return items.stream().filter(i -> i.status() == status).count();
    }
}
