package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

/**
 * Request DTO for status changes of tasks and sessions.
 * POST /api/v1/tasks/{id}/status, POST /api/v1/sessions/{id}/status
 * <p>
 * The status stays a string here; the target enum parses it.
 */
public record StatusRequest(@JsonProperty("status") String status) {

    public void validate() {
        if (status == null || status.isBlank()) {
            throw new ValidationException("status is required");
        }
    }
}
