package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.MessageRequest;
import maestro.coordinator.api.v1.dto.PushRequest;
import maestro.coordinator.api.v1.dto.QueueResponse;
import maestro.coordinator.model.QueueItem;
import maestro.coordinator.service.ClaimFuture;
import maestro.coordinator.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for session work queues (worker API).
 *
 * GET /api/v1/sessions/{id}/queue - Queue with per-status counts
 * GET /api/v1/sessions/{id}/queue/stats - Counts only
 * GET /api/v1/sessions/{id}/queue/peek - Next queued item, or null
 * GET /api/v1/sessions/{id}/queue/current - Claimed item under the cursor, or null
 * GET /api/v1/queues - All queues
 * POST /api/v1/sessions/{id}/queue/push - Append tasks
 * POST /api/v1/sessions/{id}/queue/claim?timeoutMs= - Long-poll for the next item
 * POST /api/v1/sessions/{id}/queue/complete|fail|skip - Finish the claimed item
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private static final Pattern QUEUE_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)/queue$");
    private static final Pattern QUEUE_STATS_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)/queue/stats$");
    private static final Pattern QUEUE_ITEM_PATTERN =
            Pattern.compile("^/api/v1/sessions/([^/]+)/queue/(peek|current)$");
    private static final String QUEUES_PATH = "/api/v1/queues";
    private static final Pattern QUEUE_ACTION_PATTERN =
            Pattern.compile("^/api/v1/sessions/([^/]+)/queue/(push|claim|complete|fail|skip)$");

    private final QueueService queueService;
    private final Duration defaultClaimTimeout;

    public QueueController(QueueService queueService, Duration defaultClaimTimeout) {
        this.queueService = queueService;
        this.defaultClaimTimeout = defaultClaimTimeout;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return QUEUES_PATH.equals(path)
                    || QUEUE_PATTERN.matcher(path).matches()
                    || QUEUE_STATS_PATTERN.matcher(path).matches()
                    || QUEUE_ITEM_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && QUEUE_ACTION_PATTERN.matcher(path).matches();
    }

    /**
     * Claims are answered when an item arrives or the wait times out; the
     * event loop is never blocked. Closing the channel cancels the wait.
     */
    @Override
    public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        Matcher action = QUEUE_ACTION_PATTERN.matcher(path);
        if (!action.matches() || !"claim".equals(action.group(2))) {
            return CompletableFuture.completedFuture(handle(ctx, req, path));
        }

        String sessionId = action.group(1);
        ClaimFuture claim = queueService.claimNextAsync(sessionId, claimTimeout(req));
        CompletableFuture<ControllerResponse> response = claim.thenApplyAsync(ControllerResponse::ok, ctx.executor());
        response.whenComplete((r, error) -> {
            if (error instanceof CancellationException && claim.cancel(true)) {
                log.debug("Claim for session {} abandoned by client", sessionId);
            }
        });
        return response;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (QUEUES_PATH.equals(path)) {
            return ControllerResponse.ok(queueService.listQueues().stream().map(QueueResponse::from).toList());
        }
        Matcher queue = QUEUE_PATTERN.matcher(path);
        if (queue.matches()) {
            return ControllerResponse.ok(QueueResponse.from(queueService.getQueue(queue.group(1))));
        }
        Matcher stats = QUEUE_STATS_PATTERN.matcher(path);
        if (stats.matches()) {
            return ControllerResponse.ok(queueService.stats(stats.group(1)));
        }
        Matcher item = QUEUE_ITEM_PATTERN.matcher(path);
        if (item.matches()) {
            Optional<QueueItem> found = "peek".equals(item.group(2))
                    ? queueService.peek(item.group(1))
                    : queueService.current(item.group(1));
            return ControllerResponse.ok(Collections.singletonMap("item", found.orElse(null)));
        }

        Matcher action = QUEUE_ACTION_PATTERN.matcher(path);
        if (!action.matches()) {
            return ControllerResponse.notFound("unknown queue endpoint");
        }
        String sessionId = action.group(1);
        switch (action.group(2)) {
            case "push": {
                PushRequest request = HttpRequests.body(req, PushRequest.class);
                request.validate();
                return ControllerResponse.ok(QueueResponse.from(queueService.push(sessionId, request.taskIds())));
            }
            case "claim":
                return ControllerResponse.ok(queueService.claimNext(sessionId, claimTimeout(req)));
            case "complete":
                return ControllerResponse.ok(queueService.complete(sessionId));
            case "fail": {
                MessageRequest request = HttpRequests.body(req, MessageRequest.class, MessageRequest.EMPTY);
                return ControllerResponse.ok(queueService.fail(sessionId, request.text()));
            }
            default:
                return ControllerResponse.ok(queueService.skip(sessionId));
        }
    }

    private Duration claimTimeout(FullHttpRequest req) {
        Long timeoutMs = HttpRequests.queryLong(req, "timeoutMs");
        return timeoutMs != null ? Duration.ofMillis(timeoutMs) : defaultClaimTimeout;
    }
}
