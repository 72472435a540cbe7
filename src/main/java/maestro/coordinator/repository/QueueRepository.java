package maestro.coordinator.repository;

import maestro.coordinator.model.WorkQueue;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for per-session work queues, keyed by session ID.
 */
public interface QueueRepository {

    void save(WorkQueue queue);

    Optional<WorkQueue> findBySessionId(String sessionId);

    List<WorkQueue> findAll();

    boolean delete(String sessionId);
}
