package maestro.coordinator.error;

/**
 * Persistence layer failure. Fatal to the triggering request, not to the process.
 */
public class StorageException extends CoordinatorException {

    public static final String ERROR_CODE = "STORAGE_ERROR";

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, 500, message, cause);
    }
}
