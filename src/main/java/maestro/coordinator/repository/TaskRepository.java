package maestro.coordinator.repository;

import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Writes touching a session as well go through a store batch instead.
 */
public interface TaskRepository {

    /**
     * Insert or replace a task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * All tasks, oldest first.
     */
    List<Task> findAll();

    /**
     * Find all tasks of a project.
     *
     * @param projectId the project ID
     * @return tasks ordered by creation time
     */
    List<Task> findByProjectId(String projectId);

    /**
     * Find tasks by overall status.
     *
     * @param status the status to filter by
     * @return tasks ordered by creation time
     */
    List<Task> findByStatus(TaskStatus status);

    /**
     * Direct children of a task.
     *
     * @param parentId the parent task ID
     * @return tasks ordered by creation time
     */
    List<Task> findByParentId(String parentId);

    /**
     * Tasks whose session set contains the session.
     */
    List<Task> findBySessionId(String sessionId);

    int count();

    /**
     * Delete a task record without touching its sessions.
     *
     * @return true if a record was removed
     */
    boolean delete(String taskId);
}
