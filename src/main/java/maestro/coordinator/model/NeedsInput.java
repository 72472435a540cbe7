package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * "Waiting for user input" flag of a session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NeedsInput(boolean active, String message, Instant since) {

    public static NeedsInput raised(String message, Instant since) {
        return new NeedsInput(true, message, since);
    }

    public static NeedsInput cleared() {
        return new NeedsInput(false, null, null);
    }
}
