package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("tasks") Integer tasks,
        @JsonProperty("sessions") Integer sessions,
        @JsonProperty("runningSessions") Integer runningSessions,
        @JsonProperty("observers") Integer observers) {

    public static HealthResponse healthy(String uptime, String version, int tasks, int sessions,
            int runningSessions, int observers) {
        return new HealthResponse("healthy", "ok", uptime, version, tasks, sessions, runningSessions, observers);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
