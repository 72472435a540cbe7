package maestro.coordinator.error;

/**
 * Thrown when a project, task, session or queue is not found.
 */
public class NotFoundException extends CoordinatorException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, 404, String.format("%s with id '%s' not found", entityType, entityId));
    }
}
