package maestro.coordinator.repository;

import maestro.coordinator.model.TaskList;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for TaskList persistence.
 */
public interface TaskListRepository {

    void save(TaskList taskList);

    Optional<TaskList> findById(String taskListId);

    /**
     * Task lists of one project, oldest first.
     */
    List<TaskList> findByProjectId(String projectId);

    /**
     * Task lists whose order contains the task.
     */
    List<TaskList> findByTaskId(String taskId);

    List<TaskList> findAll();

    boolean delete(String taskListId);
}
