package maestro.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body carrying an optional free-text message (needs-input prompts, failure reasons).
 */
public record MessageRequest(
        @JsonProperty("message") String message,
        @JsonProperty("reason") String reason) {

    public static final MessageRequest EMPTY = new MessageRequest(null, null);

    /** The reason if given, else the message. */
    public String text() {
        return reason != null ? reason : message;
    }
}
