package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.service.SessionUpdate;

import java.util.Map;

/**
 * Request DTO for a partial session update.
 * PATCH /api/v1/sessions/{id}
 */
public record UpdateSessionRequest(
        @JsonProperty("name") String name,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public static final UpdateSessionRequest EMPTY = new UpdateSessionRequest(null, null, null, null);

    public SessionUpdate toSessionUpdate() {
        return new SessionUpdate(name, status, env, metadata);
    }
}
