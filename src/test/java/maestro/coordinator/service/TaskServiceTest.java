package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskPriority;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private Dependencies deps;
    private TaskService tasks;
    private String projectId;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        tasks = deps.taskService();
        projectId = deps.projectService().create("tasks", "/tmp/t", null).id();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private Task create(String title) {
        return tasks.create(NewTask.of(projectId, title));
    }

    @Test
    void createAppliesDefaults() {
        Task task = tasks.create(NewTask.of(projectId, "  Write parser  "));

        assertTrue(task.id().startsWith("task_"));
        assertEquals("Write parser", task.title());
        assertEquals(TaskStatus.TODO, task.status());
        assertEquals(TaskPriority.MEDIUM, task.priority());
        assertNotNull(task.createdAt());
        assertNull(task.startedAt());
        assertTrue(task.sessionIds().isEmpty());
    }

    @Test
    void createValidatesReferences() {
        assertThrows(ValidationException.class, () -> tasks.create(NewTask.of(projectId, " ")));
        assertThrows(NotFoundException.class, () -> tasks.create(NewTask.of("proj_missing", "x")));
        assertThrows(NotFoundException.class,
                () -> tasks.create(NewTask.of(projectId, "child").withParent("task_missing")));
    }

    @Nested
    class StatusTransitions {

        @Test
        void progressStampsStartAndCompletion() {
            Task task = create("t");

            Task started = tasks.updateStatus(task.id(), TaskStatus.IN_PROGRESS);
            assertNotNull(started.startedAt());
            assertNull(started.completedAt());

            Task reviewed = tasks.updateStatus(task.id(), TaskStatus.IN_REVIEW);
            Task resumed = tasks.updateStatus(task.id(), TaskStatus.IN_PROGRESS);
            assertEquals(started.startedAt(), resumed.startedAt());
            assertEquals(TaskStatus.IN_REVIEW, reviewed.status());

            Task done = tasks.updateStatus(task.id(), TaskStatus.COMPLETED);
            assertNotNull(done.completedAt());
            assertTrue(done.isTerminal());
        }

        @Test
        void disallowedTransitionIsRejected() {
            Task task = create("t");
            assertThrows(ValidationException.class, () -> tasks.updateStatus(task.id(), TaskStatus.COMPLETED));
            assertEquals(TaskStatus.TODO, tasks.get(task.id()).status());

            tasks.updateStatus(task.id(), TaskStatus.IN_PROGRESS);
            tasks.updateStatus(task.id(), TaskStatus.CANCELLED);
            assertThrows(ValidationException.class, () -> tasks.updateStatus(task.id(), TaskStatus.IN_PROGRESS));
        }

        @Test
        void sameStatusIsNoOp() {
            Task task = create("t");
            Task unchanged = tasks.updateStatus(task.id(), TaskStatus.TODO);
            assertEquals(task, unchanged);
        }

        @Test
        void completionPublishesNotification() {
            Task task = create("t");
            List<Object> notified = Collections.synchronizedList(new ArrayList<>());
            deps.eventBus().subscribe(DomainEvents.NOTIFY_TASK_COMPLETED, e -> notified.add(e.payload()));

            tasks.updateStatus(task.id(), TaskStatus.IN_PROGRESS);
            tasks.updateStatus(task.id(), TaskStatus.COMPLETED);

            assertEquals(1, notified.size());
            assertEquals(task.id(), ((DomainEvents.Notification) notified.get(0)).taskId());
        }
    }

    @Nested
    class SessionSourcedUpdates {

        @Test
        void sessionUpdateChangesOnlyItsOwnStatus() {
            Task task = create("t");
            String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of(task.id()))).id();

            Task updated = tasks.update(task.id(), TaskUpdate.fromSession(sessionId, TaskSessionStatus.COMPLETED));

            assertEquals(TaskSessionStatus.COMPLETED, updated.sessionStatus(sessionId));
            assertEquals(TaskStatus.TODO, updated.status());
        }

        @Test
        void unlinkedSessionIsRejected() {
            Task task = create("t");
            assertThrows(ValidationException.class,
                    () -> tasks.update(task.id(), TaskUpdate.fromSession("sess_other", TaskSessionStatus.WORKING)));
        }
    }

    @Nested
    class DependencyEdits {

        @Test
        void cycleIsRejected() {
            Task a = create("a");
            Task b = create("b");
            Task c = create("c");
            tasks.setDependencies(a.id(), List.of(b.id()));
            tasks.setDependencies(b.id(), List.of(c.id()));

            ValidationException error = assertThrows(ValidationException.class,
                    () -> tasks.setDependencies(c.id(), List.of(a.id())));
            assertTrue(error.getMessage().contains("cycle"));
            assertTrue(tasks.get(c.id()).dependencies().isEmpty());
        }

        @Test
        void selfAndMissingDependenciesAreRejected() {
            Task a = create("a");
            assertThrows(ValidationException.class, () -> tasks.setDependencies(a.id(), List.of(a.id())));
            assertThrows(NotFoundException.class, () -> tasks.setDependencies(a.id(), List.of("task_missing")));
        }

        @Test
        void findCycleReportsPath() {
            Map<String, List<String>> graph = Map.of(
                    "a", List.of("b"),
                    "b", List.of("c"),
                    "c", List.of("a"),
                    "d", List.of("a"));
            assertEquals(List.of("a", "b", "c", "a"), TaskService.findCycle(graph, "a"));
            assertTrue(TaskService.findCycle(Map.of("x", List.of("y")), "x").isEmpty());
        }
    }

    @Nested
    class Delete {

        @Test
        void taskWithSubtasksCannotBeDeleted() {
            Task parent = create("parent");
            tasks.create(NewTask.of(projectId, "child").withParent(parent.id()));

            assertThrows(BusinessRuleException.class, () -> tasks.delete(parent.id()));
            assertEquals(1, tasks.children(parent.id()).size());
        }

        @Test
        @DisplayName("Creating a child or dependent while its target is deleted never leaves a dangling reference")
        void createRacingDeleteLeavesNoDanglingReferences() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 100; round++) {
                    Task parent = create("parent-" + round);
                    raceDeleteWith(pool, parent.id(), NewTask.of(projectId, "child-" + round).withParent(parent.id()));

                    Task dependency = create("dependency-" + round);
                    raceDeleteWith(pool, dependency.id(),
                            new NewTask(projectId, null, "dependent-" + round, null, null, List.of(dependency.id())));
                }
            } finally {
                pool.shutdownNow();
            }

            Set<String> ids = tasks.list(null, null, null).stream().map(Task::id).collect(Collectors.toSet());
            for (Task task : tasks.list(null, null, null)) {
                assertTrue(task.parentId() == null || ids.contains(task.parentId()), "orphan " + task.id());
                assertTrue(ids.containsAll(task.dependencies()), "dangling dependency in " + task.id());
            }
        }

        private void raceDeleteWith(ExecutorService pool, String targetId, NewTask referencing) throws Exception {
            CountDownLatch start = new CountDownLatch(1);
            Future<?> delete = pool.submit(() -> {
                start.await();
                try {
                    tasks.delete(targetId);
                } catch (BusinessRuleException e) {
                    // a child got in first
                }
                return null;
            });
            Future<?> create = pool.submit(() -> {
                start.await();
                try {
                    tasks.create(referencing);
                } catch (NotFoundException e) {
                    // the target was deleted first
                }
                return null;
            });
            start.countDown();
            delete.get(5, TimeUnit.SECONDS);
            create.get(5, TimeUnit.SECONDS);
        }

        @Test
        void deleteDetachesSessionsAndDependents() {
            Task a = create("a");
            Task b = create("b");
            tasks.setDependencies(b.id(), List.of(a.id()));
            String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of(a.id()))).id();

            tasks.delete(a.id());

            assertThrows(NotFoundException.class, () -> tasks.get(a.id()));
            assertTrue(tasks.get(b.id()).dependencies().isEmpty());
            assertFalse(deps.sessionService().get(sessionId).hasTask(a.id()));
        }
    }
}
