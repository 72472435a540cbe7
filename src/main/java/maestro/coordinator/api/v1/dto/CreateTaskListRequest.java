package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

import java.util.List;

/**
 * Request DTO for creating a task list.
 * POST /api/v1/task-lists
 */
public record CreateTaskListRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("orderedTaskIds") List<String> orderedTaskIds) {

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
    }
}
