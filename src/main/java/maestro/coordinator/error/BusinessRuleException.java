package maestro.coordinator.error;

public class BusinessRuleException extends CoordinatorException {

    public static final String ERROR_CODE = "BUSINESS_RULE_ERROR";

    public BusinessRuleException(String message) {
        super(ERROR_CODE, 422, message);
    }
}
