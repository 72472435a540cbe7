package maestro.coordinator.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Events collected while entity locks are held, published once they are released.
 * Handlers may then call back into services without lock-order inversions.
 */
public final class Outbox {

    private final List<Pending> pending = new ArrayList<>();

    public Outbox add(String name, Object payload) {
        pending.add(new Pending(name, payload));
        return this;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /** Event names in the order they were added. */
    public List<String> names() {
        return pending.stream().map(Pending::name).toList();
    }

    public void publishTo(EventBus bus) {
        for (Pending event : pending) {
            bus.publish(event.name(), event.payload());
        }
        pending.clear();
    }

    private record Pending(String name, Object payload) {
    }
}
