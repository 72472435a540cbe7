package maestro.coordinator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import maestro.coordinator.error.CoordinatorException;
import maestro.coordinator.error.ValidationException;
import maestro.coordinator.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Body and query-string helpers shared by the controllers.
 */
public final class HttpRequests {

    private HttpRequests() {
    }

    /**
     * Decode a JSON body. An empty body decodes to {@code empty}.
     *
     * @throws ValidationException if the body is not valid JSON for the type
     */
    public static <T> T body(FullHttpRequest req, Class<T> type, T empty) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return empty;
        }
        try {
            return Jsons.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw unwrap(e);
        }
    }

    /**
     * Decode a JSON body that must be present.
     */
    public static <T> T body(FullHttpRequest req, Class<T> type) {
        T value = body(req, type, null);
        if (value == null) {
            throw new ValidationException("Request body is required");
        }
        return value;
    }

    /** First value of a query parameter, or null. */
    public static String query(FullHttpRequest req, String name) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public static Long queryLong(FullHttpRequest req, String name) {
        String value = query(req, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(String.format("Query parameter '%s' must be a number", name));
        }
    }

    // Enum @JsonCreator failures arrive wrapped in Jackson exceptions.
    private static CoordinatorException unwrap(JsonProcessingException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof CoordinatorException coordinatorException) {
                return coordinatorException;
            }
            cause = cause.getCause();
        }
        return new ValidationException("Invalid JSON body: " + e.getOriginalMessage());
    }
}
