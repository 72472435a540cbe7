package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.TaskPriority;
import maestro.coordinator.service.NewTask;

import java.util.List;

/**
 * Request DTO for creating a task.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("parentId") String parentId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("priority") TaskPriority priority,
        @JsonProperty("dependencies") List<String> dependencies) {

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
    }

    public NewTask toNewTask() {
        return new NewTask(projectId, parentId, title, description, priority, dependencies);
    }
}
