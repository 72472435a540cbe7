package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.SessionStrategy;
import maestro.coordinator.service.NewSession;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for spawning a session record.
 * POST /api/v1/sessions
 */
public record CreateSessionRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("taskIds") List<String> taskIds,
        @JsonProperty("strategy") SessionStrategy strategy,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId is required");
        }
        if (taskIds != null && taskIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new ValidationException("taskIds must not contain empty values");
        }
    }

    public NewSession toNewSession() {
        return new NewSession(projectId, name, taskIds, strategy, env, metadata);
    }
}
