package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

/**
 * Request DTO for creating a project.
 * POST /api/v1/projects
 */
public record CreateProjectRequest(
        @JsonProperty("name") String name,
        @JsonProperty("workingDir") String workingDir,
        @JsonProperty("description") String description) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
    }
}
