package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import maestro.coordinator.model.QueueStats;
import maestro.coordinator.model.WorkQueue;

/**
 * A session queue together with its per-status counts.
 * GET /api/v1/sessions/{id}/queue
 */
public record QueueResponse(
        @JsonProperty("queue") WorkQueue queue,
        @JsonProperty("stats") QueueStats stats) {

    public static QueueResponse from(WorkQueue queue) {
        return new QueueResponse(queue, QueueStats.of(queue));
    }
}
