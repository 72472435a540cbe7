package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.error.ValidationException;

import java.util.List;

/**
 * PUT /api/v1/task-lists/{id}/reorder
 */
public record ReorderRequest(@JsonProperty("orderedTaskIds") List<String> orderedTaskIds) {

    public void validate() {
        if (orderedTaskIds == null) {
            throw new ValidationException("orderedTaskIds must be an array");
        }
    }
}
