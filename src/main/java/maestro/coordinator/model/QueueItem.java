package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A claimable reference to a task inside one session's work queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueItem(
        String taskId,
        QueueItemStatus status,
        Instant addedAt,
        Instant startedAt,
        Instant completedAt,
        String failReason) {

    public QueueItem {
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(addedAt, "addedAt is required");
    }

    public static QueueItem queued(String taskId, Instant addedAt) {
        return new QueueItem(taskId, QueueItemStatus.QUEUED, addedAt, null, null, null);
    }

    public QueueItem claimed(Instant at) {
        return new QueueItem(taskId, QueueItemStatus.PROCESSING, addedAt, at, null, null);
    }

    public QueueItem finished(QueueItemStatus terminal, Instant at, String reason) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal queue status: " + terminal);
        }
        return new QueueItem(taskId, terminal, addedAt, startedAt, at, reason);
    }
}
