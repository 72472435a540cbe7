package maestro.coordinator.error;

/**
 * Malformed input or an illegal state transition.
 */
public class ValidationException extends CoordinatorException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(ERROR_CODE, 400, message);
    }
}
