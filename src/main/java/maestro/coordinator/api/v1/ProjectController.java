package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.CreateProjectRequest;
import maestro.coordinator.api.v1.dto.UpdateProjectRequest;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.model.Project;
import maestro.coordinator.service.ProjectService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for projects.
 *
 * POST /api/v1/projects - Create a project
 * GET /api/v1/projects - List projects
 * GET /api/v1/projects/{id} - Get a project
 * PATCH /api/v1/projects/{id} - Update name, working directory or description
 * DELETE /api/v1/projects/{id} - Delete a project that owns nothing
 */
public class ProjectController implements Controller {

    private static final Pattern PROJECTS_PATTERN = Pattern.compile("^/api/v1/projects$");
    private static final Pattern PROJECT_BY_ID_PATTERN = Pattern.compile("^/api/v1/projects/([^/]+)$");

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (PROJECTS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (PROJECT_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (PROJECTS_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                CreateProjectRequest request = HttpRequests.body(req, CreateProjectRequest.class);
                request.validate();
                Project project = projectService.create(request.name(), request.workingDir(), request.description());
                return ControllerResponse.created(project);
            }
            return ControllerResponse.ok(projectService.list());
        }

        Matcher byId = PROJECT_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String projectId = byId.group(1);
            if (method.equals(HttpMethod.GET)) {
                return ControllerResponse.ok(projectService.get(projectId));
            }
            if (method.equals(HttpMethod.PATCH)) {
                UpdateProjectRequest request = HttpRequests.body(req, UpdateProjectRequest.class,
                        UpdateProjectRequest.EMPTY);
                return ControllerResponse.ok(projectService.update(projectId, request.name(),
                        request.workingDir(), request.description()));
            }
            projectService.delete(projectId);
            return ControllerResponse.ok(new DomainEvents.Deleted(projectId));
        }
        return ControllerResponse.notFound("unknown project endpoint");
    }
}
