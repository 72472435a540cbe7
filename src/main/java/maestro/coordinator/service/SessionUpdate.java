package maestro.coordinator.service;

import maestro.coordinator.model.SessionStatus;

import java.util.Map;

/**
 * Partial session update; null fields are left unchanged, maps are merged.
 */
public record SessionUpdate(
        String name,
        SessionStatus status,
        Map<String, String> env,
        Map<String, String> metadata) {

    public static SessionUpdate status(SessionStatus status) {
        return new SessionUpdate(null, status, null, null);
    }
}
