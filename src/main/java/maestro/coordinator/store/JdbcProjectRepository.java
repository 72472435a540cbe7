package maestro.coordinator.store;

import maestro.coordinator.model.Project;
import maestro.coordinator.repository.ProjectRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * ProjectRepository backed by the {@link RecordStore}.
 */
public class JdbcProjectRepository implements ProjectRepository {

    private static final Comparator<Project> BY_CREATION = Comparator.comparing(Project::createdAt,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final RecordStore store;

    public JdbcProjectRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(Project project) {
        store.commit(RecordBatch.create().project(project));
    }

    @Override
    public Optional<Project> findById(String projectId) {
        return store.find(RecordKind.PROJECT, projectId, Project.class);
    }

    @Override
    public List<Project> findAll() {
        List<Project> projects = store.list(RecordKind.PROJECT, Project.class);
        projects.sort(BY_CREATION);
        return projects;
    }
}
