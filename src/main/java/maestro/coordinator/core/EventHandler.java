package maestro.coordinator.core;

/**
 * Callback registered on the {@link EventBus}. A handler may throw; the bus
 * logs the failure and keeps delivering to the other handlers.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event) throws Exception;
}
