package maestro.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a blocking claim: either the claimed item or an explicit "no work"
 * marker when the wait timed out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimResult(boolean claimed, QueueItem item, String sessionId) {

    public static ClaimResult claimed(String sessionId, QueueItem item) {
        return new ClaimResult(true, item, sessionId);
    }

    public static ClaimResult noWork(String sessionId) {
        return new ClaimResult(false, null, sessionId);
    }

    @JsonIgnore
    public boolean isNoWork() {
        return !claimed;
    }
}
