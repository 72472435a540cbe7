package maestro.coordinator.service;

import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.OrderingEntity;
import maestro.coordinator.repository.OrderingRepository;
import maestro.coordinator.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Saved display order of tasks, sessions or task lists per project.
 */
public class OrderingService {

    private static final Logger log = LoggerFactory.getLogger(OrderingService.class);

    private final OrderingRepository orderingRepository;
    private final ProjectRepository projectRepository;
    private final KeyedLocks locks;

    public OrderingService(OrderingRepository orderingRepository, ProjectRepository projectRepository,
            KeyedLocks locks) {
        this.orderingRepository = orderingRepository;
        this.projectRepository = projectRepository;
        this.locks = locks;
    }

    /** The saved order, or an empty one if none was saved. */
    public Ordering get(String projectId, OrderingEntity entityType) {
        return orderingRepository.find(projectId, entityType)
                .orElseGet(() -> Ordering.empty(projectId, entityType));
    }

    public Ordering save(String projectId, OrderingEntity entityType, List<String> orderedIds) {
        if (orderedIds == null) {
            throw new ValidationException("orderedIds must be an array");
        }
        Ordering ordering = locks.withLock(KeyedLocks.projectKey(projectId), () -> {
            projectRepository.findById(projectId).orElseThrow(() -> new NotFoundException("Project", projectId));
            Ordering saved = new Ordering(projectId, entityType, orderedIds, Instant.now());
            orderingRepository.save(saved);
            return saved;
        });
        log.debug("Saved {} ordering of project {} ({} ids)", entityType.wireName(), projectId, orderedIds.size());
        return ordering;
    }
}
