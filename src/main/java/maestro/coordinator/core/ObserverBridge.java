package maestro.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards every domain event to all connected observers.
 * <p>
 * The bus handler only enqueues: each observer owns an unbounded FIFO drained
 * by a background task, so a slow or stuck observer delays nobody but itself.
 * Observers see events published after they registered, with no backlog.
 */
public class ObserverBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ObserverBridge.class);

    private final EventBus eventBus;
    private final ConcurrentHashMap<Observer, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();
    private final ExecutorService executor;

    public ObserverBridge(EventBus eventBus) {
        this.eventBus = eventBus;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "maestro-observer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Subscribe to every event name the bus can emit. */
    public void start() {
        for (String name : DomainEvents.ALL) {
            subscriptions.add(eventBus.subscribe(name, this::forward));
        }
        log.info("Observer bridge subscribed to {} event types", DomainEvents.ALL.size());
    }

    /**
     * Start forwarding events to an observer.
     *
     * @return a handle that removes the observer again
     */
    public Registration register(Observer observer) {
        mailboxes.put(observer, new Mailbox(observer));
        log.info("Observer {} connected ({} total)", observer.id(), mailboxes.size());
        return () -> unregister(observer);
    }

    public void unregister(Observer observer) {
        Mailbox mailbox = mailboxes.remove(observer);
        if (mailbox != null) {
            mailbox.pending.clear();
            log.info("Observer {} disconnected ({} remaining)", observer.id(), mailboxes.size());
        }
    }

    public int observerCount() {
        return mailboxes.size();
    }

    private void forward(DomainEvent event) {
        for (Mailbox mailbox : mailboxes.values()) {
            mailbox.offer(event);
        }
    }

    @Override
    public void close() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
        mailboxes.clear();
        executor.shutdownNow();
    }

    /**
     * Handle for removing a registered observer.
     */
    @FunctionalInterface
    public interface Registration {
        void unregister();
    }

    private final class Mailbox {
        private final Observer observer;
        private final Queue<DomainEvent> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();

        private Mailbox(Observer observer) {
            this.observer = observer;
        }

        void offer(DomainEvent event) {
            pending.add(event);
            schedule();
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.debug("Observer bridge closed, dropping events for {}", observer.id());
            }
        }

        private void drain() {
            DomainEvent event;
            while ((event = pending.poll()) != null) {
                if (!observer.isOpen()) {
                    unregister(observer);
                    return;
                }
                try {
                    observer.onEvent(event);
                } catch (Exception e) {
                    log.warn("Observer {} failed on {}: {}", observer.id(), event.name(), e.getMessage());
                }
            }
            draining.set(false);
            if (!pending.isEmpty()) {
                schedule();
            }
        }
    }
}
