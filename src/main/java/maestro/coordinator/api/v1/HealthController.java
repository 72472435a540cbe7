package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.v1.dto.HealthResponse;
import maestro.coordinator.core.ObserverBridge;
import maestro.coordinator.service.SessionService;
import maestro.coordinator.service.TaskService;
import maestro.coordinator.store.Database;
import maestro.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskService taskService;
    private final SessionService sessionService;
    private final ObserverBridge observerBridge;

    public HealthController(Database database, TaskService taskService, SessionService sessionService,
            ObserverBridge observerBridge) {
        this.database = database;
        this.taskService = taskService;
        this.sessionService = sessionService;
        this.observerBridge = observerBridge;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            log.warn("Health check: database connection failed");
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    Jsons.toJson(HealthResponse.unhealthy("connection failed")));
        }
        HealthResponse response = HealthResponse.healthy(
                formatUptime(), VERSION,
                taskService.count(),
                sessionService.count(),
                sessionService.countRunning(),
                observerBridge.observerCount());
        return ControllerResponse.ok(response);
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
