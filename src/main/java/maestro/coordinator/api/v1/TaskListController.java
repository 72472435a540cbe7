package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.CreateTaskListRequest;
import maestro.coordinator.api.v1.dto.ReorderRequest;
import maestro.coordinator.api.v1.dto.UpdateTaskListRequest;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.model.TaskList;
import maestro.coordinator.service.TaskListService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task lists.
 *
 * GET /api/v1/task-lists?projectId= - List task lists
 * POST /api/v1/task-lists - Create a task list
 * GET|PATCH|DELETE /api/v1/task-lists/{id}
 * POST|DELETE /api/v1/task-lists/{id}/tasks/{taskId} - Add or remove one task
 * PUT /api/v1/task-lists/{id}/reorder - Replace the order
 */
public class TaskListController implements Controller {

    private static final Pattern LISTS_PATTERN = Pattern.compile("^/api/v1/task-lists$");
    private static final Pattern LIST_BY_ID_PATTERN = Pattern.compile("^/api/v1/task-lists/([^/]+)$");
    private static final Pattern LIST_TASK_PATTERN = Pattern.compile("^/api/v1/task-lists/([^/]+)/tasks/([^/]+)$");
    private static final Pattern REORDER_PATTERN = Pattern.compile("^/api/v1/task-lists/([^/]+)/reorder$");

    private final TaskListService taskListService;

    public TaskListController(TaskListService taskListService) {
        this.taskListService = taskListService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (LISTS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (LIST_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        if (LIST_TASK_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE);
        }
        return REORDER_PATTERN.matcher(path).matches() && method.equals(HttpMethod.PUT);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (LISTS_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                CreateTaskListRequest request = HttpRequests.body(req, CreateTaskListRequest.class);
                request.validate();
                TaskList taskList = taskListService.create(request.projectId(), request.name(),
                        request.description(), request.orderedTaskIds());
                return ControllerResponse.created(taskList);
            }
            return ControllerResponse.ok(taskListService.list(HttpRequests.query(req, "projectId")));
        }

        Matcher listTask = LIST_TASK_PATTERN.matcher(path);
        if (listTask.matches()) {
            String taskListId = listTask.group(1);
            String taskId = listTask.group(2);
            if (method.equals(HttpMethod.POST)) {
                return ControllerResponse.ok(taskListService.addTask(taskListId, taskId));
            }
            return ControllerResponse.ok(taskListService.removeTask(taskListId, taskId));
        }

        Matcher reorder = REORDER_PATTERN.matcher(path);
        if (reorder.matches()) {
            ReorderRequest request = HttpRequests.body(req, ReorderRequest.class);
            request.validate();
            return ControllerResponse.ok(taskListService.reorder(reorder.group(1), request.orderedTaskIds()));
        }

        Matcher byId = LIST_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String taskListId = byId.group(1);
            if (method.equals(HttpMethod.GET)) {
                return ControllerResponse.ok(taskListService.get(taskListId));
            }
            if (method.equals(HttpMethod.PATCH)) {
                UpdateTaskListRequest request = HttpRequests.body(req, UpdateTaskListRequest.class,
                        UpdateTaskListRequest.EMPTY);
                return ControllerResponse.ok(taskListService.update(taskListId, request.name(),
                        request.description(), request.orderedTaskIds()));
            }
            taskListService.delete(taskListId);
            return ControllerResponse.ok(new DomainEvents.Deleted(taskListId));
        }
        return ControllerResponse.notFound("unknown task list endpoint");
    }
}
