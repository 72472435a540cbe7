package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.TaskPriority;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TaskStatus;
import maestro.coordinator.service.TaskUpdate;

/**
 * Request DTO for a partial task update.
 * PATCH /api/v1/tasks/{id}
 * <p>
 * {@code updateSource: "session"} marks a worker-originated update, which may
 * only set {@code sessionStatus} for {@code sessionId}.
 */
public record UpdateTaskRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("priority") TaskPriority priority,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("sessionStatus") TaskSessionStatus sessionStatus,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("updateSource") String updateSource) {

    public static final UpdateTaskRequest EMPTY = new UpdateTaskRequest(null, null, null, null, null, null, null);

    public TaskUpdate toTaskUpdate() {
        TaskUpdate.Source source = TaskUpdate.Source.USER;
        if (updateSource != null) {
            if ("session".equalsIgnoreCase(updateSource)) {
                source = TaskUpdate.Source.SESSION;
            } else if (!"user".equalsIgnoreCase(updateSource)) {
                throw new ValidationException("updateSource must be 'user' or 'session'");
            }
        }
        return new TaskUpdate(title, description, priority, status, sessionStatus, sessionId, source);
    }
}
