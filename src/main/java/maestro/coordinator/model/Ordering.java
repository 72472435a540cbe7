package maestro.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Saved display order of one entity kind within a project.
 * Ids are stored as given; unknown ids are the reader's concern.
 */
public record Ordering(
        String projectId,
        OrderingEntity entityType,
        List<String> orderedIds,
        Instant updatedAt) {

    public Ordering {
        Objects.requireNonNull(projectId, "projectId is required");
        Objects.requireNonNull(entityType, "entityType is required");
        orderedIds = orderedIds == null ? List.of() : List.copyOf(orderedIds);
    }

    /** The order returned when nothing was saved yet. */
    public static Ordering empty(String projectId, OrderingEntity entityType) {
        return new Ordering(projectId, entityType, List.of(), null);
    }

    /** Record id of the ordering of {@code entityType} in {@code projectId}. */
    public static String key(String projectId, OrderingEntity entityType) {
        return entityType.wireName() + ":" + projectId;
    }
}
