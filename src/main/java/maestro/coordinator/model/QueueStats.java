package maestro.coordinator.model;

/**
 * Item counts of a work queue, per status.
 */
public record QueueStats(int total, int queued, int processing, int completed, int failed, int skipped) {

    public static QueueStats of(WorkQueue queue) {
        return new QueueStats(
                queue.items().size(),
                (int) queue.count(QueueItemStatus.QUEUED),
                (int) queue.count(QueueItemStatus.PROCESSING),
                (int) queue.count(QueueItemStatus.COMPLETED),
                (int) queue.count(QueueItemStatus.FAILED),
                (int) queue.count(QueueItemStatus.SKIPPED));
    }
}
