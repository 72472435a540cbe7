package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.CreateTaskRequest;
import maestro.coordinator.api.v1.dto.DependenciesRequest;
import maestro.coordinator.api.v1.dto.StatusRequest;
import maestro.coordinator.api.v1.dto.UpdateTaskRequest;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.model.TaskStatus;
import maestro.coordinator.service.TaskService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for tasks.
 *
 * POST /api/v1/tasks - Create a task
 * GET /api/v1/tasks?projectId=&status=&parentId= - List tasks
 * GET|PATCH|DELETE /api/v1/tasks/{id}
 * POST /api/v1/tasks/{id}/status - Validated status transition
 * PUT /api/v1/tasks/{id}/dependencies - Replace dependencies (cycle checked)
 * GET /api/v1/tasks/{id}/children - Direct subtasks
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_STATUS_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/status$");
    private static final Pattern TASK_DEPENDENCIES_PATTERN =
            Pattern.compile("^/api/v1/tasks/([^/]+)/dependencies$");
    private static final Pattern TASK_CHILDREN_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/children$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        if (TASK_STATUS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (TASK_DEPENDENCIES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.PUT);
        }
        return method.equals(HttpMethod.GET) && TASK_CHILDREN_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (TASKS_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                CreateTaskRequest request = HttpRequests.body(req, CreateTaskRequest.class);
                request.validate();
                return ControllerResponse.created(taskService.create(request.toNewTask()));
            }
            String status = HttpRequests.query(req, "status");
            return ControllerResponse.ok(taskService.list(
                    HttpRequests.query(req, "projectId"),
                    status != null ? TaskStatus.fromWire(status) : null,
                    HttpRequests.query(req, "parentId")));
        }

        Matcher status = TASK_STATUS_PATTERN.matcher(path);
        if (status.matches()) {
            StatusRequest request = HttpRequests.body(req, StatusRequest.class);
            request.validate();
            return ControllerResponse.ok(taskService.updateStatus(status.group(1),
                    TaskStatus.fromWire(request.status())));
        }

        Matcher dependencies = TASK_DEPENDENCIES_PATTERN.matcher(path);
        if (dependencies.matches()) {
            DependenciesRequest request = HttpRequests.body(req, DependenciesRequest.class);
            return ControllerResponse.ok(taskService.setDependencies(dependencies.group(1),
                    request.dependenciesOrEmpty()));
        }

        Matcher children = TASK_CHILDREN_PATTERN.matcher(path);
        if (children.matches()) {
            String taskId = children.group(1);
            taskService.get(taskId);
            return ControllerResponse.ok(taskService.children(taskId));
        }

        Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String taskId = byId.group(1);
            if (method.equals(HttpMethod.GET)) {
                return ControllerResponse.ok(taskService.get(taskId));
            }
            if (method.equals(HttpMethod.PATCH)) {
                UpdateTaskRequest request = HttpRequests.body(req, UpdateTaskRequest.class, UpdateTaskRequest.EMPTY);
                return ControllerResponse.ok(taskService.update(taskId, request.toTaskUpdate()));
            }
            taskService.delete(taskId);
            return ControllerResponse.ok(new DomainEvents.Deleted(taskId));
        }
        return ControllerResponse.notFound("unknown task endpoint");
    }
}
