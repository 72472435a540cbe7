package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.error.NotFoundException;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipMaintainerTest {

    private Dependencies deps;
    private RelationshipMaintainer relationships;
    private String projectId;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-links-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        relationships = deps.relationships();
        projectId = deps.projectService().create("links", "/tmp/l", null).id();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private boolean linked(String taskId, String sessionId) {
        boolean taskSide = deps.taskService().get(taskId).hasSession(sessionId);
        boolean sessionSide = deps.sessionService().get(sessionId).hasTask(taskId);
        assertEquals(taskSide, sessionSide, "link must be recorded on both sides");
        return taskSide;
    }

    @Test
    void attachIsIdempotent() {
        String taskId = deps.taskService().create(NewTask.of(projectId, "t")).id();
        String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of())).id();
        List<String> added = Collections.synchronizedList(new ArrayList<>());
        deps.eventBus().subscribe(DomainEvents.TASK_SESSION_ADDED, e -> added.add(e.name()));

        assertTrue(relationships.attachTask(sessionId, taskId));
        assertFalse(relationships.attachSession(taskId, sessionId));

        assertTrue(linked(taskId, sessionId));
        assertEquals(1, added.size());
        assertEquals(List.of(sessionId), deps.taskService().get(taskId).sessionIds());
    }

    @Test
    void linkChangesRefreshSessionActivity() throws Exception {
        String taskId = deps.taskService().create(NewTask.of(projectId, "t")).id();
        String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of())).id();
        Instant created = deps.sessionService().get(sessionId).lastActivity();

        Thread.sleep(20);
        relationships.attachTask(sessionId, taskId);
        Instant attached = deps.sessionService().get(sessionId).lastActivity();
        assertTrue(attached.isAfter(created), created + " -> " + attached);

        Thread.sleep(20);
        relationships.detachTask(sessionId, taskId);
        Instant detached = deps.sessionService().get(sessionId).lastActivity();
        assertTrue(detached.isAfter(attached), attached + " -> " + detached);
    }

    @Test
    void deletingTaskRefreshesSessionActivity() throws Exception {
        String taskId = deps.taskService().create(NewTask.of(projectId, "t")).id();
        String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of(taskId))).id();
        Instant before = deps.sessionService().get(sessionId).lastActivity();

        Thread.sleep(20);
        deps.taskService().delete(taskId);

        assertTrue(deps.sessionService().get(sessionId).lastActivity().isAfter(before));
    }

    @Test
    void detachRemovesBothSides() {
        String taskId = deps.taskService().create(NewTask.of(projectId, "t")).id();
        String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of(taskId))).id();

        assertTrue(relationships.detachSession(taskId, sessionId));
        assertFalse(relationships.detachTask(sessionId, taskId));

        assertFalse(linked(taskId, sessionId));
    }

    @Test
    void missingSideIsNotFound() {
        String taskId = deps.taskService().create(NewTask.of(projectId, "t")).id();
        assertThrows(NotFoundException.class, () -> relationships.attachTask("sess_missing", taskId));
        assertThrows(NotFoundException.class, () -> relationships.detachSession("task_missing", "sess_missing"));
    }

    @Test
    @DisplayName("Concurrent attach and detach of many pairs leave both sides consistent")
    void concurrentLinksStayConsistent() throws Exception {
        String sessionId = deps.sessionService().create(NewSession.of(projectId, List.of())).id();
        List<String> taskIds = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            taskIds.add(deps.taskService().create(NewTask.of(projectId, "t" + i)).id());
        }

        List<Thread> threads = new ArrayList<>();
        for (String taskId : taskIds) {
            threads.add(new Thread(() -> {
                relationships.attachTask(sessionId, taskId);
                if (taskId.hashCode() % 2 == 0) {
                    relationships.detachTask(sessionId, taskId);
                }
            }));
        }
        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join(5000);
        }

        for (String taskId : taskIds) {
            assertEquals(taskId.hashCode() % 2 != 0, linked(taskId, sessionId));
        }
    }
}
