package maestro.coordinator.service;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.error.BusinessRuleException;
import maestro.coordinator.error.NotFoundException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.model.Project;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectServiceTest {

    private static Dependencies deps;
    private static ProjectService projects;

    @BeforeAll
    static void setUp() {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-projects;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        projects = deps.projectService();
    }

    @AfterAll
    static void tearDown() {
        deps.close();
    }

    @Test
    void createAndUpdate() {
        Project created = projects.create("Demo", "/work/demo", "first");
        assertTrue(created.id().startsWith("proj_"));

        Project renamed = projects.update(created.id(), "Renamed", null, null);
        assertEquals("Renamed", renamed.name());
        assertEquals("/work/demo", renamed.workingDir());
        assertEquals("first", renamed.description());
        assertEquals(created.createdAt(), renamed.createdAt());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(ValidationException.class, () -> projects.create(" ", null, null));
        Project created = projects.create("Keep", null, null);
        assertThrows(ValidationException.class, () -> projects.update(created.id(), "", null, null));
    }

    @Test
    void deleteRequiresEmptyProject() {
        Project project = projects.create("Busy", null, null);
        String taskId = deps.taskService().create(NewTask.of(project.id(), "t")).id();

        assertThrows(BusinessRuleException.class, () -> projects.delete(project.id()));

        deps.taskService().delete(taskId);
        String sessionId = deps.sessionService().create(NewSession.of(project.id(), List.of())).id();
        assertThrows(BusinessRuleException.class, () -> projects.delete(project.id()));

        deps.sessionService().delete(sessionId);
        projects.delete(project.id());
        assertThrows(NotFoundException.class, () -> projects.get(project.id()));
    }
}
