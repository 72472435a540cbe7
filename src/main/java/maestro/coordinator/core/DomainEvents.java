package maestro.coordinator.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Names of every event the coordinator publishes, plus small payload types
 * for events that do not carry a full record.
 */
public final class DomainEvents {

    private DomainEvents() {
    }

    // Projects
    public static final String PROJECT_CREATED = "project:created";
    public static final String PROJECT_UPDATED = "project:updated";
    public static final String PROJECT_DELETED = "project:deleted";

    // Tasks
    public static final String TASK_CREATED = "task:created";
    public static final String TASK_UPDATED = "task:updated";
    public static final String TASK_DELETED = "task:deleted";
    public static final String TASK_SESSION_ADDED = "task:session_added";
    public static final String TASK_SESSION_REMOVED = "task:session_removed";

    // Sessions
    public static final String SESSION_CREATED = "session:created";
    public static final String SESSION_UPDATED = "session:updated";
    public static final String SESSION_DELETED = "session:deleted";
    public static final String SESSION_TASK_ADDED = "session:task_added";
    public static final String SESSION_TASK_REMOVED = "session:task_removed";

    // Work queues
    public static final String QUEUE_CREATED = "queue:created";
    public static final String QUEUE_ITEM_PUSHED = "queue:item_pushed";
    public static final String QUEUE_ITEM_CLAIMED = "queue:item_claimed";
    public static final String QUEUE_ITEM_COMPLETED = "queue:item_completed";
    public static final String QUEUE_ITEM_FAILED = "queue:item_failed";
    public static final String QUEUE_ITEM_SKIPPED = "queue:item_skipped";
    public static final String QUEUE_DELETED = "queue:deleted";

    // Task lists
    public static final String TASK_LIST_CREATED = "task_list:created";
    public static final String TASK_LIST_UPDATED = "task_list:updated";
    public static final String TASK_LIST_REORDERED = "task_list:reordered";
    public static final String TASK_LIST_DELETED = "task_list:deleted";

    // Notifications, fired alongside the CRUD events for high-impact transitions
    public static final String NOTIFY_TASK_COMPLETED = "notify:task_completed";
    public static final String NOTIFY_TASK_BLOCKED = "notify:task_blocked";
    public static final String NOTIFY_TASK_IN_REVIEW = "notify:task_in_review";
    public static final String NOTIFY_SESSION_COMPLETED = "notify:session_completed";
    public static final String NOTIFY_SESSION_FAILED = "notify:session_failed";
    public static final String NOTIFY_NEEDS_INPUT = "notify:needs_input";
    public static final String NOTIFY_PROGRESS = "notify:progress";

    public static final List<String> ALL = List.of(
            PROJECT_CREATED, PROJECT_UPDATED, PROJECT_DELETED,
            TASK_CREATED, TASK_UPDATED, TASK_DELETED, TASK_SESSION_ADDED, TASK_SESSION_REMOVED,
            SESSION_CREATED, SESSION_UPDATED, SESSION_DELETED, SESSION_TASK_ADDED, SESSION_TASK_REMOVED,
            QUEUE_CREATED, QUEUE_ITEM_PUSHED, QUEUE_ITEM_CLAIMED, QUEUE_ITEM_COMPLETED,
            QUEUE_ITEM_FAILED, QUEUE_ITEM_SKIPPED, QUEUE_DELETED,
            TASK_LIST_CREATED, TASK_LIST_UPDATED, TASK_LIST_REORDERED, TASK_LIST_DELETED,
            NOTIFY_TASK_COMPLETED, NOTIFY_TASK_BLOCKED, NOTIFY_TASK_IN_REVIEW,
            NOTIFY_SESSION_COMPLETED, NOTIFY_SESSION_FAILED, NOTIFY_NEEDS_INPUT, NOTIFY_PROGRESS);

    /** Payload of deletion events. */
    public record Deleted(String id) {
    }

    /** Payload of link events ({@code task:session_added}, {@code session:task_removed}, ...). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Link(String taskId, String sessionId) {
    }

    /** Payload of queue item events. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueueItemChange(String sessionId, String taskId, String reason) {
    }

    /** Payload of {@code notify:*} events. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Notification(String taskId, String sessionId, String title, String message) {
    }
}
