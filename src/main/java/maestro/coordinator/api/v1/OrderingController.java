package maestro.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.HttpRequests;
import maestro.coordinator.api.v1.dto.OrderingRequest;
import maestro.coordinator.model.OrderingEntity;
import maestro.coordinator.service.OrderingService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for saved display orders.
 *
 * GET /api/v1/ordering/{entityType}/{projectId} - Saved order, empty if none
 * PUT /api/v1/ordering/{entityType}/{projectId} - Replace the order
 *
 * entityType is one of task, session or task-list.
 */
public class OrderingController implements Controller {

    private static final Pattern ORDERING_PATTERN = Pattern.compile("^/api/v1/ordering/([^/]+)/([^/]+)$");

    private final OrderingService orderingService;

    public OrderingController(OrderingService orderingService) {
        this.orderingService = orderingService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return ORDERING_PATTERN.matcher(path).matches()
                && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = ORDERING_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown ordering endpoint");
        }
        OrderingEntity entityType = OrderingEntity.fromWire(matcher.group(1));
        String projectId = matcher.group(2);
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.ok(orderingService.get(projectId, entityType));
        }
        OrderingRequest request = HttpRequests.body(req, OrderingRequest.class);
        request.validate();
        return ControllerResponse.ok(orderingService.save(projectId, entityType, request.orderedIds()));
    }
}
