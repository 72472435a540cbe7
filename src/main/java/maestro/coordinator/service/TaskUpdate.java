package maestro.coordinator.service;

import maestro.coordinator.model.TaskPriority;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TaskStatus;

/**
 * Partial task update; null fields are left unchanged.
 * <p>
 * A {@link Source#SESSION} update may only set {@code sessionStatus} for its
 * own {@code sessionId}; every other field is ignored.
 */
public record TaskUpdate(
        String title,
        String description,
        TaskPriority priority,
        TaskStatus status,
        TaskSessionStatus sessionStatus,
        String sessionId,
        Source source) {

    public enum Source {
        USER, SESSION
    }

    public static TaskUpdate status(TaskStatus status) {
        return new TaskUpdate(null, null, null, status, null, null, Source.USER);
    }

    public static TaskUpdate fromSession(String sessionId, TaskSessionStatus sessionStatus) {
        return new TaskUpdate(null, null, null, null, sessionStatus, sessionId, Source.SESSION);
    }

    public boolean isSessionSourced() {
        return source == Source.SESSION;
    }
}
