package maestro.coordinator.core;

import java.time.Instant;

/**
 * A committed state change, as delivered to event handlers.
 *
 * @param name      event name, e.g. {@code task:updated}
 * @param payload   full updated record, or an id/link payload for deletions and link changes
 * @param timestamp when the event was published
 */
public record DomainEvent(String name, Object payload, Instant timestamp) {
}
