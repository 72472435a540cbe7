package maestro.coordinator.error;

/**
 * Base exception for all coordinator errors.
 * Every error carries a stable machine-readable code and the HTTP status
 * the router answers with.
 */
public class CoordinatorException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    public CoordinatorException(String code, int httpStatus, String message) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public CoordinatorException(String code, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
