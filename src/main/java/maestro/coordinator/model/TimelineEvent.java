package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only entry of a session timeline.
 *
 * @param id        entry id ({@code evt_...})
 * @param type      entry type from the closed {@link TimelineEventType} set
 * @param timestamp when the entry was recorded
 * @param message   optional human-readable message
 * @param taskId    optional task the entry relates to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineEvent(
        String id,
        TimelineEventType type,
        Instant timestamp,
        String message,
        String taskId) {

    public TimelineEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
