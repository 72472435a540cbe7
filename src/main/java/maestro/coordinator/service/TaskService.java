package maestro.coordinator.service;

import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.Outbox;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.model.TaskPriority;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TaskStatus;
import maestro.coordinator.repository.ProjectRepository;
import maestro.coordinator.repository.TaskListRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.store.RecordBatch;
import maestro.coordinator.store.RecordKind;
import maestro.coordinator.store.RecordStore;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service layer for Task operations.
 * Validates status transitions, stamps lifecycle timestamps and publishes
 * task events after each committed change.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    /** Serializes dependency edits so cycle checks see a stable graph. */
    static final String DEPENDENCY_GRAPH_KEY = "graph:dependencies";

    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final TaskListRepository taskListRepository;
    private final RecordStore store;
    private final RelationshipMaintainer relationships;
    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;

    public TaskService(TaskRepository taskRepository, ProjectRepository projectRepository,
            TaskListRepository taskListRepository, RecordStore store, RelationshipMaintainer relationships,
            KeyedLocks locks, EventBus eventBus, IdGenerator idGenerator) {
        this.taskRepository = taskRepository;
        this.projectRepository = projectRepository;
        this.taskListRepository = taskListRepository;
        this.store = store;
        this.relationships = relationships;
        this.locks = locks;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    // ========== Create / read ==========

    public Task create(NewTask input) {
        if (input.projectId() == null || input.projectId().isBlank()) {
            throw new ValidationException("Project ID is required");
        }
        if (input.title() == null || input.title().isBlank()) {
            throw new ValidationException("Task title is required");
        }
        List<String> dependencies = input.dependencies() == null ? List.of()
                : List.copyOf(new LinkedHashSet<>(input.dependencies()));

        // Parent and dependency locks exclude a concurrent delete of the referenced tasks
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyedLocks.projectKey(input.projectId()));
        if (input.parentId() != null) {
            keys.add(KeyedLocks.taskKey(input.parentId()));
        }
        dependencies.forEach(id -> keys.add(KeyedLocks.taskKey(id)));
        if (input.parentId() != null || !dependencies.isEmpty()) {
            keys.add(DEPENDENCY_GRAPH_KEY);
        }
        Task task = locks.withLocks(keys, () -> {
            projectRepository.findById(input.projectId())
                    .orElseThrow(() -> new NotFoundException("Project", input.projectId()));
            if (input.parentId() != null) {
                taskRepository.findById(input.parentId())
                        .orElseThrow(() -> new NotFoundException("Parent task", input.parentId()));
            }
            for (String dependency : dependencies) {
                taskRepository.findById(dependency).orElseThrow(() -> new NotFoundException("Task", dependency));
            }

            Instant now = Instant.now();
            Task created = Task.builder()
                    .id(idGenerator.generate("task"))
                    .projectId(input.projectId())
                    .parentId(input.parentId())
                    .title(input.title().trim())
                    .description(input.description())
                    .priority(input.priority() != null ? input.priority() : TaskPriority.MEDIUM)
                    .status(TaskStatus.TODO)
                    .dependencies(dependencies)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            taskRepository.save(created);
            return created;
        });

        log.info("Created task {} in project {}", task.id(), task.projectId());
        eventBus.publish(DomainEvents.TASK_CREATED, task);
        return task;
    }

    public Task get(String taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    /**
     * List tasks, optionally filtered. Null filters match everything.
     */
    public List<Task> list(String projectId, TaskStatus status, String parentId) {
        List<Task> tasks = projectId != null ? taskRepository.findByProjectId(projectId)
                : parentId != null ? taskRepository.findByParentId(parentId)
                        : taskRepository.findAll();
        return tasks.stream()
                .filter(t -> status == null || t.status() == status)
                .filter(t -> parentId == null || parentId.equals(t.parentId()))
                .collect(Collectors.toList());
    }

    public List<Task> children(String parentId) {
        get(parentId);
        return taskRepository.findByParentId(parentId);
    }

    public int count() {
        return taskRepository.count();
    }

    // ========== Updates ==========

    /**
     * Change the overall status of a task.
     * Requesting the current status is a no-op.
     *
     * @throws ValidationException if the transition is not allowed
     */
    public Task updateStatus(String taskId, TaskStatus target) {
        return update(taskId, TaskUpdate.status(target));
    }

    public Task update(String taskId, TaskUpdate update) {
        if (update.isSessionSourced()) {
            return updateSessionStatus(taskId, update.sessionId(), update.sessionStatus());
        }
        if (update.title() != null && update.title().isBlank()) {
            throw new ValidationException("Task title cannot be empty");
        }

        Outbox outbox = new Outbox();
        Task result = locks.withLock(KeyedLocks.taskKey(taskId), () -> {
            Task current = get(taskId);
            Instant now = Instant.now();
            Task.Builder next = current.toBuilder();
            boolean changed = false;

            if (update.title() != null && !update.title().trim().equals(current.title())) {
                next.title(update.title().trim());
                changed = true;
            }
            if (update.description() != null && !update.description().equals(current.description())) {
                next.description(update.description());
                changed = true;
            }
            if (update.priority() != null && update.priority() != current.priority()) {
                next.priority(update.priority());
                changed = true;
            }
            if (update.sessionStatus() != null) {
                changed |= putSessionStatus(current, next, update.sessionId(), update.sessionStatus());
            }
            boolean statusChanged = update.status() != null && update.status() != current.status();
            if (statusChanged) {
                applyTransition(current, update.status(), next, now);
                changed = true;
            }
            if (!changed) {
                return current;
            }

            Task updated = next.updatedAt(now).build();
            taskRepository.save(updated);
            outbox.add(DomainEvents.TASK_UPDATED, updated);
            if (statusChanged) {
                addStatusNotification(updated, outbox);
            }
            return updated;
        });
        outbox.publishTo(eventBus);
        log.debug("Task {} updated, status {}", taskId, result.status());
        return result;
    }

    /**
     * Set one session's own status for a task, leaving every other field alone.
     */
    public Task updateSessionStatus(String taskId, String sessionId, TaskSessionStatus status) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId is required for a session update");
        }
        if (status == null) {
            throw new ValidationException("sessionStatus is required for a session update");
        }
        Outbox outbox = new Outbox();
        Task result = locks.withLock(KeyedLocks.taskKey(taskId), () -> {
            Task current = get(taskId);
            Task.Builder next = current.toBuilder();
            if (!putSessionStatus(current, next, sessionId, status)) {
                return current;
            }
            Task updated = next.updatedAt(Instant.now()).build();
            taskRepository.save(updated);
            outbox.add(DomainEvents.TASK_UPDATED, updated);
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    /**
     * Replace the dependency list of a task.
     *
     * @throws ValidationException on self-dependency or if the edit would create a cycle
     * @throws NotFoundException   if a dependency does not exist
     */
    public Task setDependencies(String taskId, List<String> dependencies) {
        List<String> requested = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
        Outbox outbox = new Outbox();
        Task result = locks.withLocks(List.of(KeyedLocks.taskKey(taskId), DEPENDENCY_GRAPH_KEY), () -> {
            Task current = get(taskId);
            for (String dependency : requested) {
                if (dependency.equals(taskId)) {
                    throw new ValidationException("Task cannot depend on itself");
                }
                taskRepository.findById(dependency).orElseThrow(() -> new NotFoundException("Task", dependency));
            }
            if (requested.equals(current.dependencies())) {
                return current;
            }

            Map<String, List<String>> graph = new HashMap<>();
            for (Task task : taskRepository.findAll()) {
                graph.put(task.id(), task.dependencies());
            }
            graph.put(taskId, requested);
            List<String> cycle = findCycle(graph, taskId);
            if (!cycle.isEmpty()) {
                throw new ValidationException("Dependency cycle: " + String.join(" -> ", cycle));
            }

            Task updated = current.toBuilder().dependencies(requested).updatedAt(Instant.now()).build();
            taskRepository.save(updated);
            outbox.add(DomainEvents.TASK_UPDATED, updated);
            return updated;
        });
        outbox.publishTo(eventBus);
        return result;
    }

    // ========== Delete ==========

    /**
     * Delete a task, detaching it from every session and removing it from the
     * dependency lists of other tasks and from every task list.
     *
     * @throws BusinessRuleException if the task still has subtasks
     */
    public void delete(String taskId) {
        Outbox outbox = new Outbox();
        locks.withResolvedLocks(() -> deleteLockKeys(taskId), () -> {
            get(taskId);
            if (!taskRepository.findByParentId(taskId).isEmpty()) {
                throw new BusinessRuleException("Cannot delete task with subtasks");
            }

            RecordBatch batch = RecordBatch.create();
            relationships.releaseSessionsOf(taskId, batch, outbox);
            Instant now = Instant.now();
            for (Task dependent : dependentsOf(taskId)) {
                List<String> remaining = new ArrayList<>(dependent.dependencies());
                remaining.remove(taskId);
                Task updated = dependent.toBuilder().dependencies(remaining).updatedAt(now).build();
                batch.task(updated);
                outbox.add(DomainEvents.TASK_UPDATED, updated);
            }
            for (TaskList taskList : taskListRepository.findByTaskId(taskId)) {
                List<String> remaining = new ArrayList<>(taskList.orderedTaskIds());
                remaining.remove(taskId);
                TaskList updated = taskList.withTaskIds(remaining, now);
                batch.taskList(updated);
                outbox.add(DomainEvents.TASK_LIST_UPDATED, updated);
            }
            batch.delete(RecordKind.TASK, taskId);
            store.commit(batch);
            outbox.add(DomainEvents.TASK_DELETED, new DomainEvents.Deleted(taskId));
            return null;
        });
        outbox.publishTo(eventBus);
        log.info("Deleted task {}", taskId);
    }

    private Set<String> deleteLockKeys(String taskId) {
        Set<String> keys = new LinkedHashSet<>(relationships.taskLockKeys(taskId));
        dependentsOf(taskId).forEach(t -> keys.add(KeyedLocks.taskKey(t.id())));
        taskListRepository.findByTaskId(taskId).forEach(l -> keys.add(KeyedLocks.taskListKey(l.id())));
        keys.add(DEPENDENCY_GRAPH_KEY);
        return keys;
    }

    private List<Task> dependentsOf(String taskId) {
        return taskRepository.findAll().stream()
                .filter(t -> t.dependencies().contains(taskId))
                .collect(Collectors.toList());
    }

    // ========== Helpers ==========

    private static void applyTransition(Task current, TaskStatus target, Task.Builder next, Instant now) {
        if (!current.status().canTransitionTo(target)) {
            throw new ValidationException(String.format("Invalid status transition %s -> %s",
                    current.status().wireName(), target.wireName()));
        }
        next.status(target);
        if (target == TaskStatus.IN_PROGRESS && current.startedAt() == null) {
            next.startedAt(now);
        }
        if (target.isTerminal()) {
            next.completedAt(now);
        }
    }

    private static boolean putSessionStatus(Task current, Task.Builder next, String sessionId,
            TaskSessionStatus status) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId is required with sessionStatus");
        }
        if (!current.hasSession(sessionId)) {
            throw new ValidationException(
                    String.format("Session '%s' is not associated with task '%s'", sessionId, current.id()));
        }
        if (status == current.sessionStatus(sessionId)) {
            return false;
        }
        Map<String, TaskSessionStatus> statuses = new LinkedHashMap<>(current.taskSessionStatuses());
        statuses.put(sessionId, status);
        next.taskSessionStatuses(statuses);
        return true;
    }

    private static void addStatusNotification(Task task, Outbox outbox) {
        String event = switch (task.status()) {
            case COMPLETED -> DomainEvents.NOTIFY_TASK_COMPLETED;
            case BLOCKED -> DomainEvents.NOTIFY_TASK_BLOCKED;
            case IN_REVIEW -> DomainEvents.NOTIFY_TASK_IN_REVIEW;
            default -> null;
        };
        if (event != null) {
            outbox.add(event, new DomainEvents.Notification(task.id(), null, task.title(),
                    "Task is now " + task.status().wireName()));
        }
    }

    /**
     * Depth-first search with recursion-stack marking.
     *
     * @return the ids along a cycle reachable from {@code start}, or an empty list
     */
    static List<String> findCycle(Map<String, List<String>> graph, String start) {
        Set<String> done = new HashSet<>();
        List<String> stack = new ArrayList<>();
        Set<String> onStack = new HashSet<>();
        return visit(graph, start, done, stack, onStack);
    }

    private static List<String> visit(Map<String, List<String>> graph, String node, Set<String> done,
            List<String> stack, Set<String> onStack) {
        if (onStack.contains(node)) {
            List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(node), stack.size()));
            cycle.add(node);
            return cycle;
        }
        if (!done.add(node)) {
            return List.of();
        }
        stack.add(node);
        onStack.add(node);
        for (String next : graph.getOrDefault(node, List.of())) {
            List<String> cycle = visit(graph, next, done, stack, onStack);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(node);
        return List.of();
    }
}
