package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

import java.util.List;

/**
 * PUT /api/v1/ordering/{entityType}/{projectId}
 */
public record OrderingRequest(@JsonProperty("orderedIds") List<String> orderedIds) {

    public void validate() {
        if (orderedIds == null) {
            throw new ValidationException("orderedIds must be an array");
        }
    }
}
