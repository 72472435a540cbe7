package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.CreateSessionRequest;
import maestro.coordinator.api.v1.dto.MessageRequest;
import maestro.coordinator.api.v1.dto.StatusRequest;
import maestro.coordinator.api.v1.dto.TimelineRequest;
import maestro.coordinator.api.v1.dto.UpdateSessionRequest;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.service.SessionService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker sessions.
 *
 * POST /api/v1/sessions - Create a session
 * GET /api/v1/sessions?projectId=&taskId=&status= - List sessions
 * GET|PATCH|DELETE /api/v1/sessions/{id}
 * POST /api/v1/sessions/{id}/status
 * POST /api/v1/sessions/{id}/timeline
 * POST|DELETE /api/v1/sessions/{id}/needs-input
 * POST|DELETE /api/v1/sessions/{id}/tasks/{taskId}
 */
public class SessionController implements Controller {

    private static final Pattern SESSIONS_PATTERN = Pattern.compile("^/api/v1/sessions$");
    private static final Pattern SESSION_BY_ID_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)$");
    private static final Pattern SESSION_STATUS_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)/status$");
    private static final Pattern SESSION_TIMELINE_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)/timeline$");
    private static final Pattern SESSION_NEEDS_INPUT_PATTERN =
            Pattern.compile("^/api/v1/sessions/([^/]+)/needs-input$");
    private static final Pattern SESSION_TASK_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)/tasks/([^/]+)$");

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SESSIONS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (SESSION_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        if (SESSION_STATUS_PATTERN.matcher(path).matches() || SESSION_TIMELINE_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (SESSION_NEEDS_INPUT_PATTERN.matcher(path).matches() || SESSION_TASK_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (SESSIONS_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                CreateSessionRequest request = HttpRequests.body(req, CreateSessionRequest.class);
                request.validate();
                return ControllerResponse.created(sessionService.create(request.toNewSession()));
            }
            String status = HttpRequests.query(req, "status");
            return ControllerResponse.ok(sessionService.list(
                    HttpRequests.query(req, "projectId"),
                    HttpRequests.query(req, "taskId"),
                    status != null ? SessionStatus.fromWire(status) : null));
        }

        Matcher status = SESSION_STATUS_PATTERN.matcher(path);
        if (status.matches()) {
            StatusRequest request = HttpRequests.body(req, StatusRequest.class);
            request.validate();
            return ControllerResponse.ok(sessionService.updateStatus(status.group(1),
                    SessionStatus.fromWire(request.status())));
        }

        Matcher timeline = SESSION_TIMELINE_PATTERN.matcher(path);
        if (timeline.matches()) {
            TimelineRequest request = HttpRequests.body(req, TimelineRequest.class);
            request.validate();
            return ControllerResponse.ok(sessionService.appendTimeline(timeline.group(1), request.type(),
                    request.message(), request.taskId()));
        }

        Matcher needsInput = SESSION_NEEDS_INPUT_PATTERN.matcher(path);
        if (needsInput.matches()) {
            if (method.equals(HttpMethod.POST)) {
                MessageRequest request = HttpRequests.body(req, MessageRequest.class, MessageRequest.EMPTY);
                return ControllerResponse.ok(sessionService.raiseNeedsInput(needsInput.group(1), request.text()));
            }
            return ControllerResponse.ok(sessionService.clearNeedsInput(needsInput.group(1)));
        }

        Matcher task = SESSION_TASK_PATTERN.matcher(path);
        if (task.matches()) {
            if (method.equals(HttpMethod.POST)) {
                return ControllerResponse.ok(sessionService.addTask(task.group(1), task.group(2)));
            }
            return ControllerResponse.ok(sessionService.removeTask(task.group(1), task.group(2)));
        }

        Matcher byId = SESSION_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String sessionId = byId.group(1);
            if (method.equals(HttpMethod.GET)) {
                return ControllerResponse.ok(sessionService.get(sessionId));
            }
            if (method.equals(HttpMethod.PATCH)) {
                UpdateSessionRequest request = HttpRequests.body(req, UpdateSessionRequest.class,
                        UpdateSessionRequest.EMPTY);
                return ControllerResponse.ok(sessionService.update(sessionId, request.toSessionUpdate()));
            }
            sessionService.delete(sessionId);
            return ControllerResponse.ok(new DomainEvents.Deleted(sessionId));
        }
        return ControllerResponse.notFound("unknown session endpoint");
    }
}
