package maestro.coordinator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import maestro.coordinator.util.Jsons;

import java.util.concurrent.CompletableFuture;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Handle a request whose response may not be ready when this method returns.
     * The request is released once this method returns, so implementations
     * must read everything they need from it first. The router cancels the
     * returned future when the channel closes.
     */
    default CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        return CompletableFuture.completedFuture(handle(ctx, req, path));
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize a value as the JSON body of a 200 response. */
        public static ControllerResponse ok(Object value) {
            return json(Jsons.toJson(value));
        }

        public static ControllerResponse created(Object value) {
            return json(HttpResponseStatus.CREATED, Jsons.toJson(value));
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        public static ControllerResponse notFound(String message) {
            return json(HttpResponseStatus.NOT_FOUND,
                    Jsons.toJson(ErrorBody.of("NOT_FOUND", HttpResponseStatus.NOT_FOUND.code(), message)));
        }

        public static ControllerResponse error(String code, int status, String message) {
            return json(HttpResponseStatus.valueOf(status), Jsons.toJson(ErrorBody.of(code, status, message)));
        }
    }

    /**
     * Uniform error body: {@code {"error":true,"code":..,"message":..,"statusCode":..}}.
     */
    record ErrorBody(boolean error, String code, String message, int statusCode) {

        public static ErrorBody of(String code, int statusCode, String message) {
            return new ErrorBody(true, code, message, statusCode);
        }
    }
}
