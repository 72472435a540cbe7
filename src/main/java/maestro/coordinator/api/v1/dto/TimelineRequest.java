package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

/**
 * Request DTO for appending a session timeline entry.
 * POST /api/v1/sessions/{id}/timeline
 */
public record TimelineRequest(
        @JsonProperty("type") String type,
        @JsonProperty("message") String message,
        @JsonProperty("taskId") String taskId) {

    public void validate() {
        if (type == null || type.isBlank()) {
            throw new ValidationException("type is required");
        }
    }
}
