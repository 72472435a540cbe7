package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.Outbox;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.repository.ProjectRepository;
import maestro.coordinator.repository.TaskListRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Service layer for TaskList operations.
 * Every task in a list must exist, belong to the list's project and appear once.
 */
public class TaskListService {

    private static final Logger log = LoggerFactory.getLogger(TaskListService.class);

    private final TaskListRepository taskListRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;

    public TaskListService(TaskListRepository taskListRepository, ProjectRepository projectRepository,
            TaskRepository taskRepository, KeyedLocks locks, EventBus eventBus, IdGenerator idGenerator) {
        this.taskListRepository = taskListRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.locks = locks;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    public TaskList create(String projectId, String name, String description, List<String> orderedTaskIds) {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("Project ID is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Task list name is required");
        }
        List<String> taskIds = orderedTaskIds == null ? List.of() : orderedTaskIds;

        Set<String> keys = taskKeys(taskIds);
        keys.add(KeyedLocks.projectKey(projectId));
        TaskList taskList = locks.withLocks(keys, () -> {
            projectRepository.findById(projectId).orElseThrow(() -> new NotFoundException("Project", projectId));
            validateTaskIds(projectId, taskIds);
            Instant now = Instant.now();
            TaskList created = new TaskList(idGenerator.generate("task_list"), projectId, name.trim(),
                    description, taskIds, now, now);
            taskListRepository.save(created);
            return created;
        });

        log.info("Created task list {} in project {}", taskList.id(), projectId);
        eventBus.publish(DomainEvents.TASK_LIST_CREATED, taskList);
        return taskList;
    }

    public TaskList get(String taskListId) {
        return taskListRepository.findById(taskListId)
                .orElseThrow(() -> new NotFoundException("Task list", taskListId));
    }

    /**
     * All task lists, or those of one project when {@code projectId} is given.
     */
    public List<TaskList> list(String projectId) {
        return projectId != null ? taskListRepository.findByProjectId(projectId) : taskListRepository.findAll();
    }

    /**
     * Update name, description or order; null arguments are left unchanged.
     */
    public TaskList update(String taskListId, String name, String description, List<String> orderedTaskIds) {
        if (name != null && name.isBlank()) {
            throw new ValidationException("Task list name cannot be empty");
        }
        TaskList updated = edit(taskListId, orderedTaskIds, current -> {
            TaskList next = current.withDetails(name != null ? name.trim() : null, description, Instant.now());
            return orderedTaskIds != null ? next.withTaskIds(orderedTaskIds, next.updatedAt()) : next;
        });
        log.debug("Updated task list {}", taskListId);
        eventBus.publish(DomainEvents.TASK_LIST_UPDATED, updated);
        return updated;
    }

    /**
     * Replace the order of a list.
     */
    public TaskList reorder(String taskListId, List<String> orderedTaskIds) {
        if (orderedTaskIds == null) {
            throw new ValidationException("orderedTaskIds is required");
        }
        TaskList reordered = edit(taskListId, orderedTaskIds,
                current -> current.withTaskIds(orderedTaskIds, Instant.now()));
        log.debug("Reordered task list {}", taskListId);
        eventBus.publish(DomainEvents.TASK_LIST_REORDERED, reordered);
        return reordered;
    }

    /**
     * Append a task to a list. Adding a task already in the list is a no-op.
     */
    public TaskList addTask(String taskListId, String taskId) {
        List<String> keys = List.of(KeyedLocks.taskListKey(taskListId), KeyedLocks.taskKey(taskId));
        Outbox outbox = new Outbox();
        TaskList result = locks.withLocks(keys, () -> {
            TaskList current = get(taskListId);
            Task task = taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
            requireSameProject(task, current.projectId());
            if (current.contains(taskId)) {
                return current;
            }
            List<String> taskIds = new ArrayList<>(current.orderedTaskIds());
            taskIds.add(taskId);
            TaskList updated = current.withTaskIds(taskIds, Instant.now());
            taskListRepository.save(updated);
            outbox.add(DomainEvents.TASK_LIST_UPDATED, updated);
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    /**
     * Remove a task from a list. Removing a task that is not listed is a no-op.
     */
    public TaskList removeTask(String taskListId, String taskId) {
        Outbox outbox = new Outbox();
        TaskList result = locks.withLock(KeyedLocks.taskListKey(taskListId), () -> {
            TaskList current = get(taskListId);
            if (!current.contains(taskId)) {
                return current;
            }
            List<String> taskIds = new ArrayList<>(current.orderedTaskIds());
            taskIds.remove(taskId);
            TaskList updated = current.withTaskIds(taskIds, Instant.now());
            taskListRepository.save(updated);
            outbox.add(DomainEvents.TASK_LIST_UPDATED, updated);
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    public void delete(String taskListId) {
        locks.withLock(KeyedLocks.taskListKey(taskListId), () -> {
            get(taskListId);
            return taskListRepository.delete(taskListId);
        });
        log.info("Deleted task list {}", taskListId);
        eventBus.publish(DomainEvents.TASK_LIST_DELETED, new DomainEvents.Deleted(taskListId));
    }

    // ========== Helpers ==========

    private TaskList edit(String taskListId, List<String> orderedTaskIds,
            UnaryOperator<TaskList> change) {
        Set<String> keys = taskKeys(orderedTaskIds == null ? List.of() : orderedTaskIds);
        keys.add(KeyedLocks.taskListKey(taskListId));
        return locks.withLocks(keys, () -> {
            TaskList current = get(taskListId);
            if (orderedTaskIds != null) {
                validateTaskIds(current.projectId(), orderedTaskIds);
            }
            TaskList updated = change.apply(current);
            taskListRepository.save(updated);
            return updated;
        });
    }

    private static Set<String> taskKeys(List<String> taskIds) {
        Set<String> keys = new LinkedHashSet<>();
        taskIds.forEach(id -> keys.add(KeyedLocks.taskKey(id)));
        return keys;
    }

    private void validateTaskIds(String projectId, List<String> taskIds) {
        Set<String> seen = new HashSet<>();
        for (String taskId : taskIds) {
            if (taskId == null || taskId.isBlank()) {
                throw new ValidationException("Task ID cannot be empty");
            }
            if (!seen.add(taskId)) {
                throw new ValidationException("Duplicate taskId in orderedTaskIds: " + taskId);
            }
            Task task = taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
            requireSameProject(task, projectId);
        }
    }

    private static void requireSameProject(Task task, String projectId) {
        if (!task.projectId().equals(projectId)) {
            throw new ValidationException(
                    String.format("Task %s does not belong to project %s", task.id(), projectId));
        }
    }
}
