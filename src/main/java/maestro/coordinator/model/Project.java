package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Named root scope owning tasks and sessions by reference.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Project(
        String id,
        String name,
        String workingDir,
        String description,
        Instant createdAt,
        Instant updatedAt) {

    public Project {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
    }

    public Project withDetails(String name, String workingDir, String description, Instant now) {
        return new Project(id,
                name != null ? name : this.name,
                workingDir != null ? workingDir : this.workingDir,
                description != null ? description : this.description,
                createdAt, now);
    }
}
