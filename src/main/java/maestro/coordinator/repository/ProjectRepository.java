package maestro.coordinator.repository;

import maestro.coordinator.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Project persistence.
 */
public interface ProjectRepository {

    /**
     * Insert or replace a project.
     *
     * @param project the project to save
     */
    void save(Project project);

    Optional<Project> findById(String projectId);

    /**
     * All projects, oldest first.
     */
    List<Project> findAll();
}
