package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.TaskList;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskListServiceTest {

    private Dependencies deps;
    private TaskListService taskLists;
    private String projectId;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-task-lists-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        taskLists = deps.taskListService();
        projectId = deps.projectService().create("lists", null, null).id();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private String task(String title) {
        return deps.taskService().create(NewTask.of(projectId, title)).id();
    }

    @Test
    void createKeepsGivenOrder() {
        String a = task("a");
        String b = task("b");

        TaskList created = taskLists.create(projectId, "  Sprint 1 ", "first", List.of(b, a));

        assertTrue(created.id().startsWith("task_list_"));
        assertEquals("Sprint 1", created.name());
        assertEquals(List.of(b, a), created.orderedTaskIds());
        assertEquals(List.of(created), taskLists.list(projectId));
        assertEquals(created, taskLists.get(created.id()));
    }

    @Test
    void createValidatesMembers() {
        String a = task("a");
        String foreign = deps.taskService()
                .create(NewTask.of(deps.projectService().create("other", null, null).id(), "x")).id();

        assertThrows(ValidationException.class, () -> taskLists.create(projectId, " ", null, null));
        assertThrows(NotFoundException.class, () -> taskLists.create("proj_missing", "n", null, null));
        assertThrows(ValidationException.class, () -> taskLists.create(projectId, "n", null, List.of(a, a)));
        assertThrows(ValidationException.class, () -> taskLists.create(projectId, "n", null, List.of(foreign)));
        assertThrows(NotFoundException.class, () -> taskLists.create(projectId, "n", null, List.of("task_missing")));
        assertTrue(taskLists.list(projectId).isEmpty());
    }

    @Test
    void addAndRemoveAreIdempotent() {
        String a = task("a");
        TaskList list = taskLists.create(projectId, "n", null, null);

        TaskList added = taskLists.addTask(list.id(), a);
        assertEquals(List.of(a), added.orderedTaskIds());
        assertEquals(added, taskLists.addTask(list.id(), a));

        TaskList removed = taskLists.removeTask(list.id(), a);
        assertTrue(removed.orderedTaskIds().isEmpty());
        assertEquals(removed, taskLists.removeTask(list.id(), a));
    }

    @Test
    void updateLeavesNullFieldsAlone() {
        String a = task("a");
        TaskList list = taskLists.create(projectId, "n", "desc", List.of(a));

        TaskList renamed = taskLists.update(list.id(), "renamed", null, null);

        assertEquals("renamed", renamed.name());
        assertEquals("desc", renamed.description());
        assertEquals(List.of(a), renamed.orderedTaskIds());
        assertThrows(ValidationException.class, () -> taskLists.update(list.id(), "", null, null));
    }

    @Test
    void reorderPublishesEvent() {
        String a = task("a");
        String b = task("b");
        TaskList list = taskLists.create(projectId, "n", null, List.of(a, b));
        List<Object> reordered = Collections.synchronizedList(new ArrayList<>());
        deps.eventBus().subscribe(DomainEvents.TASK_LIST_REORDERED, e -> reordered.add(e.payload()));

        TaskList result = taskLists.reorder(list.id(), List.of(b, a));

        assertEquals(List.of(b, a), result.orderedTaskIds());
        assertEquals(List.of(result), reordered);
        assertThrows(ValidationException.class, () -> taskLists.reorder(list.id(), null));
    }

    @Test
    void deletingTaskRemovesItFromLists() {
        String a = task("a");
        String b = task("b");
        TaskList list = taskLists.create(projectId, "n", null, List.of(a, b));

        deps.taskService().delete(a);

        assertEquals(List.of(b), taskLists.get(list.id()).orderedTaskIds());
    }

    @Test
    void projectWithListsCannotBeDeleted() {
        TaskList list = taskLists.create(projectId, "n", null, null);

        assertThrows(BusinessRuleException.class, () -> deps.projectService().delete(projectId));

        taskLists.delete(list.id());
        assertThrows(NotFoundException.class, () -> taskLists.get(list.id()));
        assertThrows(NotFoundException.class, () -> taskLists.delete(list.id()));
        deps.projectService().delete(projectId);
    }
}
