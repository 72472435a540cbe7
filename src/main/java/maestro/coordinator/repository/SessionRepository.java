package maestro.coordinator.repository;

import maestro.coordinator.model.Session;
import maestro.coordinator.model.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Session persistence.
 */
public interface SessionRepository {

    void save(Session session);

    Optional<Session> findById(String sessionId);

    /**
     * All sessions, most recently started first.
     */
    List<Session> findAll();

    List<Session> findByProjectId(String projectId);

    List<Session> findByStatus(SessionStatus status);

    /**
     * Sessions whose task set contains the task.
     */
    List<Session> findByTaskId(String taskId);

    int count();

    boolean delete(String sessionId);
}
