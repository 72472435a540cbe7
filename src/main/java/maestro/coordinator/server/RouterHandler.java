package maestro.coordinator.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpUtil;
import maestro.coordinator.api.Controller;
import maestro.coordinator.api.Controller.ControllerResponse;
import maestro.coordinator.error.CoordinatorException;
import maestro.coordinator.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 * <p>
 * Only /api/v1/* is served; everything else answers 404. Every failure is
 * answered with the uniform error body: a {@link CoordinatorException} keeps
 * its code and status, anything else becomes 500 {@code INTERNAL_ERROR}.
 * <p>
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        Controller target = null;
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                target = controller;
                break;
            }
        }
        if (target == null) {
            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, ControllerResponse.notFound("No route for " + method + " " + path), keepAlive);
            return;
        }

        CompletableFuture<ControllerResponse> pending;
        try {
            pending = target.handleAsync(ctx, req, path);
        } catch (Throwable t) {
            writeSafe(ctx, errorResponse(method, path, t), keepAlive);
            return;
        }

        if (pending.isDone()) {
            writeSafe(ctx, resolve(method, path, pending), keepAlive);
            return;
        }
        ChannelFutureListener cancelOnClose = f -> pending.cancel(true);
        ctx.channel().closeFuture().addListener(cancelOnClose);
        pending.whenCompleteAsync((response, error) -> {
            ctx.channel().closeFuture().removeListener(cancelOnClose);
            if (!ctx.channel().isActive()) {
                return;
            }
            ControllerResponse out = error == null ? response : errorResponse(method, path, error);
            writeSafe(ctx, out, keepAlive);
        }, ctx.executor());
    }

    private ControllerResponse resolve(HttpMethod method, String path, CompletableFuture<ControllerResponse> done) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            return errorResponse(method, path, e.getCause());
        } catch (Throwable t) {
            return errorResponse(method, path, t);
        }
    }

    /**
     * Map a failure to the uniform error body.
     */
    static ControllerResponse errorResponse(HttpMethod method, String path, Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof IllegalArgumentException) {
            t = new ValidationException(t.getMessage());
        }
        if (t instanceof CoordinatorException ce) {
            if (ce.httpStatus() >= 500) {
                log.error("{} {} failed: {}", method, path, ce.getMessage(), ce);
            } else {
                log.debug("{} {} rejected: {} {}", method, path, ce.code(), ce.getMessage());
            }
            return ControllerResponse.error(ce.code(), ce.httpStatus(), ce.getMessage());
        }
        log.error("Handler error: {} {} - {}", method, path, t.toString(), t);
        return ControllerResponse.error(INTERNAL_ERROR, INTERNAL_SERVER_ERROR.code(),
                t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            String body = response.body() == null ? "" : response.body();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            out.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            out.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            if (keepAlive) {
                out.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
                ctx.writeAndFlush(out);
            } else {
                ctx.writeAndFlush(out).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
