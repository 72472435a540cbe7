package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a partial project update.
 * PATCH /api/v1/projects/{id}
 */
public record UpdateProjectRequest(
        @JsonProperty("name") String name,
        @JsonProperty("workingDir") String workingDir,
        @JsonProperty("description") String description) {

    public static final UpdateProjectRequest EMPTY = new UpdateProjectRequest(null, null, null);
}
