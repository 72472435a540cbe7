package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for a partial task list update.
 * PATCH /api/v1/task-lists/{id}
 */
public record UpdateTaskListRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("orderedTaskIds") List<String> orderedTaskIds) {

    public static final UpdateTaskListRequest EMPTY = new UpdateTaskListRequest(null, null, null);
}
