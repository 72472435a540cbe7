package maestro.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process publish/subscribe bus for domain events.
 * <p>
 * {@link #publish} fans an event out to every handler registered for its name
 * on a fixed-size worker pool and returns once all of them have run. Each
 * handler invocation is isolated: a failing handler is logged and the others
 * still receive the event. Publishing from inside a handler delivers inline so
 * nested publishes cannot starve the pool.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final ThreadLocal<Boolean> DELIVERING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public EventBus(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "maestro-events-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Publish an event and wait until every registered handler has been invoked.
     *
     * @param name    event name, see {@link DomainEvents}
     * @param payload event payload
     */
    public void publish(String name, Object payload) {
        List<EventHandler> targets = handlers.get(name);
        if (targets == null || targets.isEmpty()) {
            log.trace("No handlers for event {}", name);
            return;
        }

        DomainEvent event = new DomainEvent(name, payload, Instant.now());
        List<EventHandler> snapshot = new ArrayList<>(targets);
        log.debug("Publishing {} to {} handler(s)", name, snapshot.size());

        if (snapshot.size() == 1 || DELIVERING.get()) {
            snapshot.forEach(handler -> deliverSafely(handler, event));
            return;
        }

        List<CompletableFuture<Void>> pending = new ArrayList<>(snapshot.size());
        for (EventHandler handler : snapshot) {
            try {
                pending.add(CompletableFuture.runAsync(() -> deliverSafely(handler, event), executor));
            } catch (RejectedExecutionException e) {
                deliverSafely(handler, event);
            }
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Register a handler for one event name.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String name, EventHandler handler) {
        handlers.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Handler registered for {}", name);
        return () -> unsubscribe(name, handler);
    }

    public void unsubscribe(String name, EventHandler handler) {
        CopyOnWriteArrayList<EventHandler> list = handlers.get(name);
        if (list != null && list.remove(handler)) {
            log.debug("Handler removed for {}", name);
        }
    }

    public int handlerCount(String name) {
        List<EventHandler> list = handlers.get(name);
        return list == null ? 0 : list.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(EventHandler handler, DomainEvent event) {
        boolean nested = DELIVERING.get();
        DELIVERING.set(Boolean.TRUE);
        try {
            handler.handle(event);
        } catch (Exception e) {
            log.warn("Handler threw exception processing event {}: {}", event.name(), e.getMessage(), e);
        } finally {
            DELIVERING.set(nested);
        }
    }

    @Override
    public void close() {
        handlers.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
