package maestro.coordinator.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import maestro.coordinator.core.ObserverBridge;
import maestro.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-connection handler for {@code /ws}: registers the connection with the
 * observer bridge after the handshake and answers client control messages
 * ({@code ping}, {@code subscribe}, {@code unsubscribe}).
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ObserverBridge bridge;
    private WebSocketObserver observer;
    private ObserverBridge.Registration registration;

    public WebSocketFrameHandler(ObserverBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            observer = new WebSocketObserver(ctx.channel());
            registration = bridge.register(observer);
            send(ctx, Map.of("type", "connected", "timestamp", System.currentTimeMillis()));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame text)) {
            return;
        }
        JsonNode message;
        try {
            message = Jsons.mapper().readTree(text.text());
        } catch (Exception e) {
            send(ctx, error("Invalid JSON message"));
            return;
        }
        String type = message.path("type").asText("");
        switch (type) {
            case "ping":
                send(ctx, Map.of("type", "pong", "timestamp", System.currentTimeMillis()));
                break;
            case "subscribe": {
                List<String> sessionIds = new ArrayList<>();
                message.path("sessionIds").forEach(node -> sessionIds.add(node.asText()));
                observer.subscribe(sessionIds);
                log.debug("Observer {} filtered to sessions {}", observer.id(), sessionIds);
                send(ctx, Map.of("type", "subscribed", "sessionIds", sessionIds));
                break;
            }
            case "unsubscribe":
                observer.unsubscribe();
                send(ctx, Map.of("type", "unsubscribed"));
                break;
            default:
                send(ctx, error("Unknown message type '" + type + "'"));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (registration != null) {
            registration.unregister();
            registration = null;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("WebSocket error on {}: {}", ctx.channel().id().asShortText(), cause.getMessage());
        ctx.close();
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "error");
        body.put("message", message);
        return body;
    }

    private static void send(ChannelHandlerContext ctx, Object message) {
        ctx.writeAndFlush(new TextWebSocketFrame(Jsons.toJson(message)));
    }
}
