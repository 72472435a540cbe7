package maestro.coordinator.core;

/**
 * External consumer of the live event stream, e.g. a WebSocket client.
 */
public interface Observer {

    /** Identifier used in log messages. */
    String id();

    /**
     * Receive one event. Called from the observer's own delivery thread, never
     * concurrently for the same observer and always in publish order.
     */
    void onEvent(DomainEvent event) throws Exception;

    /** An observer that reports closed is dropped from the forwarding set. */
    default boolean isOpen() {
        return true;
    }
}
