package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.Project;
import maestro.coordinator.repository.OrderingRepository;
import maestro.coordinator.repository.ProjectRepository;
import maestro.coordinator.repository.SessionRepository;
import maestro.coordinator.repository.TaskListRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.store.RecordBatch;
import maestro.coordinator.store.RecordKind;
import maestro.coordinator.store.RecordStore;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Service layer for Project operations.
 */
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final SessionRepository sessionRepository;
    private final TaskListRepository taskListRepository;
    private final OrderingRepository orderingRepository;
    private final RecordStore store;
    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;

    public ProjectService(ProjectRepository projectRepository, TaskRepository taskRepository,
            SessionRepository sessionRepository, TaskListRepository taskListRepository,
            OrderingRepository orderingRepository, RecordStore store, KeyedLocks locks, EventBus eventBus,
            IdGenerator idGenerator) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.sessionRepository = sessionRepository;
        this.taskListRepository = taskListRepository;
        this.orderingRepository = orderingRepository;
        this.store = store;
        this.locks = locks;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    public Project create(String name, String workingDir, String description) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Project name is required");
        }
        Instant now = Instant.now();
        Project project = new Project(idGenerator.generate("proj"), name.trim(),
                workingDir != null ? workingDir : "", description, now, now);
        projectRepository.save(project);

        log.info("Created project {} ({})", project.id(), project.name());
        eventBus.publish(DomainEvents.PROJECT_CREATED, project);
        return project;
    }

    public Project get(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
    }

    public List<Project> list() {
        return projectRepository.findAll();
    }

    /**
     * Update name, working directory or description; null arguments are left unchanged.
     */
    public Project update(String projectId, String name, String workingDir, String description) {
        if (name != null && name.isBlank()) {
            throw new ValidationException("Project name cannot be empty");
        }
        Project updated = locks.withLock(KeyedLocks.projectKey(projectId), () -> {
            Project current = get(projectId);
            Project next = current.withDetails(name != null ? name.trim() : null, workingDir, description,
                    Instant.now());
            projectRepository.save(next);
            return next;
        });
        log.debug("Updated project {}", projectId);
        eventBus.publish(DomainEvents.PROJECT_UPDATED, updated);
        return updated;
    }

    /**
     * Delete a project that owns no tasks, sessions or task lists, together with its saved orderings.
     *
     * @throws BusinessRuleException if tasks, sessions or task lists still reference the project
     */
    public void delete(String projectId) {
        locks.withLock(KeyedLocks.projectKey(projectId), () -> {
            get(projectId);
            if (!taskRepository.findByProjectId(projectId).isEmpty()) {
                throw new BusinessRuleException("Cannot delete project with existing tasks");
            }
            if (!sessionRepository.findByProjectId(projectId).isEmpty()) {
                throw new BusinessRuleException("Cannot delete project with existing sessions");
            }
            if (!taskListRepository.findByProjectId(projectId).isEmpty()) {
                throw new BusinessRuleException("Cannot delete project with existing task lists");
            }
            RecordBatch batch = RecordBatch.create().delete(RecordKind.PROJECT, projectId);
            orderingRepository.findByProjectId(projectId).forEach(ordering -> batch.delete(RecordKind.ORDERING,
                    Ordering.key(projectId, ordering.entityType())));
            store.commit(batch);
            return null;
        });
        log.info("Deleted project {}", projectId);
        eventBus.publish(DomainEvents.PROJECT_DELETED, new DomainEvents.Deleted(projectId));
    }
}
