package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * PUT /api/v1/tasks/{id}/dependencies
 */
public record DependenciesRequest(@JsonProperty("dependencies") List<String> dependencies) {

    public List<String> dependenciesOrEmpty() {
        return dependencies == null ? List.of() : dependencies;
    }
}
