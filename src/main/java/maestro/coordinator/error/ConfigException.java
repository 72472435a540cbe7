package maestro.coordinator.error;

public class ConfigException extends CoordinatorException {

    public static final String ERROR_CODE = "CONFIG_ERROR";

    public ConfigException(String message) {
        super(ERROR_CODE, 500, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ERROR_CODE, 500, message, cause);
    }
}
