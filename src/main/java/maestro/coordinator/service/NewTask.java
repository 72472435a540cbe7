package maestro.coordinator.service;

import maestro.coordinator.model.TaskPriority;

import java.util.List;

/**
 * Input for {@link TaskService#create}.
 *
 * @param projectId    owning project (required)
 * @param parentId     optional parent task
 * @param title        task title (required, trimmed)
 * @param description  optional description
 * @param priority     optional priority, defaults to medium
 * @param dependencies optional ids of tasks this one depends on
 */
public record NewTask(
        String projectId,
        String parentId,
        String title,
        String description,
        TaskPriority priority,
        List<String> dependencies) {

    public static NewTask of(String projectId, String title) {
        return new NewTask(projectId, null, title, null, null, null);
    }

    public NewTask withParent(String parentId) {
        return new NewTask(projectId, parentId, title, description, priority, dependencies);
    }
}
