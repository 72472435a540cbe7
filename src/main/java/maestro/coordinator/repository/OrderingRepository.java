package maestro.coordinator.repository;

import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.OrderingEntity;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for saved display orders.
 */
public interface OrderingRepository {

    void save(Ordering ordering);

    Optional<Ordering> find(String projectId, OrderingEntity entityType);

    List<Ordering> findByProjectId(String projectId);
}
