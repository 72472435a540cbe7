package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Named, ordered collection of tasks from one project.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskList(
        String id,
        String projectId,
        String name,
        String description,
        List<String> orderedTaskIds,
        Instant createdAt,
        Instant updatedAt) {

    public TaskList {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(projectId, "projectId is required");
        Objects.requireNonNull(name, "name is required");
        orderedTaskIds = orderedTaskIds == null ? List.of() : List.copyOf(orderedTaskIds);
    }

    public boolean contains(String taskId) {
        return orderedTaskIds.contains(taskId);
    }

    public TaskList withDetails(String name, String description, Instant now) {
        return new TaskList(id, projectId,
                name != null ? name : this.name,
                description != null ? description : this.description,
                orderedTaskIds, createdAt, now);
    }

    public TaskList withTaskIds(List<String> taskIds, Instant now) {
        return new TaskList(id, projectId, name, description, taskIds, createdAt, now);
    }
}
