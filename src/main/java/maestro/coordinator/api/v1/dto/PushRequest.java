package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

import java.util.List;

/**
 * Request DTO for appending tasks to a session queue.
 * POST /api/v1/sessions/{id}/queue/push
 */
public record PushRequest(@JsonProperty("taskIds") List<String> taskIds) {

    public void validate() {
        if (taskIds == null || taskIds.isEmpty()) {
            throw new ValidationException("taskIds must not be empty");
        }
    }
}
