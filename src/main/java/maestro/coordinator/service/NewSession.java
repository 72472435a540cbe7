package maestro.coordinator.service;

import maestro.coordinator.model.SessionStrategy;

import java.util.List;
import java.util.Map;

/**
 * Input for {@link SessionService#create}.
 *
 * @param projectId owning project (required)
 * @param name      display name, defaults to "Unnamed Session"
 * @param taskIds   tasks attached at creation
 * @param strategy  simple or queue; a queue session gets a work queue of its tasks
 * @param env       environment handed to the worker process
 * @param metadata  free-form string metadata
 */
public record NewSession(
        String projectId,
        String name,
        List<String> taskIds,
        SessionStrategy strategy,
        Map<String, String> env,
        Map<String, String> metadata) {

    public static NewSession of(String projectId, List<String> taskIds) {
        return new NewSession(projectId, null, taskIds, SessionStrategy.SIMPLE, null, null);
    }

    public static NewSession queue(String projectId, List<String> taskIds) {
        return new NewSession(projectId, null, taskIds, SessionStrategy.QUEUE, null, null);
    }
}
