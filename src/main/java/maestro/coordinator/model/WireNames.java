package maestro.coordinator.model;

import maestro.coordinator.error.ValidationException;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup of enum constants by their lowercase wire name.
 */
final class WireNames {

    private WireNames() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value, Function<E, String> wireName) {
        if (value == null) {
            throw new ValidationException(type.getSimpleName() + " is required");
        }
        for (E constant : type.getEnumConstants()) {
            if (wireName.apply(constant).equalsIgnoreCase(value) || constant.name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(wireName)
                .collect(Collectors.joining(", "));
        throw new ValidationException("Invalid " + type.getSimpleName() + " '" + value + "', expected one of: " + allowed);
    }
}
