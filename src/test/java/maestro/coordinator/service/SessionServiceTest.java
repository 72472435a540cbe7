package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.model.Task;
import maestro.coordinator.model.TaskSessionStatus;
import maestro.coordinator.model.TimelineEventType;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private Dependencies deps;
    private SessionService sessions;
    private String projectId;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-sessions-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        sessions = deps.sessionService();
        projectId = deps.projectService().create("sessions", "/tmp/s", null).id();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private String task(String title) {
        return deps.taskService().create(NewTask.of(projectId, title)).id();
    }

    @Test
    void createLinksTasksOnBothSides() {
        String a = task("a");
        Session session = sessions.create(NewSession.of(projectId, List.of(a)));

        assertEquals(SessionStatus.SPAWNING, session.status());
        assertEquals("Unnamed Session", session.name());
        assertEquals(List.of(a), session.taskIds());
        Task linked = deps.taskService().get(a);
        assertTrue(linked.hasSession(session.id()));
        assertEquals(TaskSessionStatus.WORKING, linked.sessionStatus(session.id()));
        assertEquals(TimelineEventType.SESSION_STARTED, session.timeline().get(0).type());
    }

    @Test
    void createRequiresExistingRecords() {
        assertThrows(NotFoundException.class, () -> sessions.create(NewSession.of("proj_missing", List.of())));
        assertThrows(NotFoundException.class, () -> sessions.create(NewSession.of(projectId, List.of("task_x"))));
        assertTrue(sessions.list(projectId, null, null).isEmpty());
    }

    @Test
    void queueSessionGetsQueue() {
        String a = task("a");
        Session session = sessions.create(NewSession.queue(projectId, List.of(a)));

        assertEquals(TaskSessionStatus.QUEUED, deps.taskService().get(a).sessionStatus(session.id()));
        assertEquals(1, deps.queueService().getQueue(session.id()).items().size());
    }

    @Nested
    class Status {

        @Test
        @DisplayName("Terminal status is stamped once and repeated updates return the stored record")
        void terminalStatusIsIdempotent() {
            Session session = sessions.create(NewSession.of(projectId, List.of()));
            sessions.updateStatus(session.id(), SessionStatus.WORKING);

            Session completed = sessions.updateStatus(session.id(), SessionStatus.COMPLETED);
            assertNotNull(completed.completedAt());

            Session again = sessions.updateStatus(session.id(), SessionStatus.COMPLETED);
            assertEquals(completed, again);
            Session otherTerminal = sessions.updateStatus(session.id(), SessionStatus.FAILED);
            assertEquals(SessionStatus.COMPLETED, otherTerminal.status());
        }

        @Test
        void terminalSessionCannotResume() {
            Session session = sessions.create(NewSession.of(projectId, List.of()));
            sessions.updateStatus(session.id(), SessionStatus.STOPPED);
            assertThrows(ValidationException.class, () -> sessions.updateStatus(session.id(), SessionStatus.WORKING));
        }

        @Test
        void terminalStatusClosesActiveTaskStatuses() {
            String a = task("a");
            Session session = sessions.create(NewSession.of(projectId, List.of(a)));

            sessions.updateStatus(session.id(), SessionStatus.FAILED);

            assertEquals(TaskSessionStatus.FAILED, deps.taskService().get(a).sessionStatus(session.id()));
        }
    }

    @Nested
    class Timeline {

        @Test
        void unknownTypeIsRejected() {
            Session session = sessions.create(NewSession.of(projectId, List.of()));
            assertThrows(ValidationException.class,
                    () -> sessions.appendTimeline(session.id(), "bogus", "msg", null));
            assertEquals(1, sessions.get(session.id()).timeline().size());
        }

        @Test
        void timelineOnlyGrows() {
            Session session = sessions.create(NewSession.of(projectId, List.of()));
            sessions.appendTimeline(session.id(), "progress", "half way", null);
            Session updated = sessions.appendTimeline(session.id(), "milestone", "parser done", null);

            assertEquals(3, updated.timeline().size());
            assertEquals(TimelineEventType.MILESTONE, updated.timeline().get(2).type());
            assertEquals("half way", updated.timeline().get(1).message());
        }

        @Test
        void needsInputEntryRaisesFlag() {
            Session session = sessions.create(NewSession.of(projectId, List.of()));

            Session waiting = sessions.appendTimeline(session.id(), "needs_input", "Which DB?", null);
            assertTrue(waiting.isWaitingForInput());

            Session cleared = sessions.clearNeedsInput(session.id());
            assertFalse(cleared.isWaitingForInput());
        }
    }

    @Nested
    class TaskLinks {

        @Test
        void addAndRemoveTaskKeepBothSidesInSync() {
            String a = task("a");
            Session session = sessions.create(NewSession.of(projectId, List.of()));

            sessions.addTask(session.id(), a);
            assertTrue(sessions.get(session.id()).hasTask(a));
            assertTrue(deps.taskService().get(a).hasSession(session.id()));

            sessions.removeTask(session.id(), a);
            assertFalse(sessions.get(session.id()).hasTask(a));
            assertFalse(deps.taskService().get(a).hasSession(session.id()));
            assertNull(deps.taskService().get(a).sessionStatus(session.id()));
        }

        @Test
        void terminalSessionRejectsNewTasks() {
            String a = task("a");
            Session session = sessions.create(NewSession.of(projectId, List.of()));
            sessions.updateStatus(session.id(), SessionStatus.COMPLETED);

            assertThrows(BusinessRuleException.class, () -> sessions.addTask(session.id(), a));
        }

        @Test
        void deleteDetachesTasks() {
            String a = task("a");
            Session session = sessions.create(NewSession.of(projectId, List.of(a)));

            sessions.delete(session.id());

            assertThrows(NotFoundException.class, () -> sessions.get(session.id()));
            Task released = deps.taskService().get(a);
            assertFalse(released.hasSession(session.id()));
            assertEquals(Map.of(), released.taskSessionStatuses());
        }
    }
}
