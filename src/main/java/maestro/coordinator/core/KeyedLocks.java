package maestro.coordinator.core;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-entity mutual exclusion over a fixed set of lock stripes.
 * <p>
 * Mutations of the same entity key are serialized; different keys usually land
 * on different stripes and proceed independently. Multi-key sections acquire
 * their stripes in ascending stripe order, so two callers locking overlapping
 * key sets cannot deadlock. Callers must not nest sections.
 */
public final class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public static String taskKey(String taskId) {
        return "task:" + taskId;
    }

    public static String sessionKey(String sessionId) {
        return "session:" + sessionId;
    }

    public static String projectKey(String projectId) {
        return "project:" + projectId;
    }

    public static String queueKey(String sessionId) {
        return "queue:" + sessionId;
    }

    public static String taskListKey(String taskListId) {
        return "task_list:" + taskListId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripes[stripeOf(key)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        TreeSet<Integer> order = new TreeSet<>();
        for (String key : keys) {
            order.add(stripeOf(key));
        }
        Integer[] held = order.toArray(new Integer[0]);
        int acquired = 0;
        try {
            for (Integer index : held) {
                stripes[index].lock();
                acquired++;
            }
            return action.get();
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                stripes[held[i]].unlock();
            }
        }
    }

    /**
     * Lock a key set that is derived from the records being locked.
     * The resolver is evaluated before locking and again while holding the
     * locks; if the set grew in between, the locks are released and taken again.
     */
    public <T> T withResolvedLocks(Supplier<? extends Collection<String>> resolver, Supplier<T> action) {
        while (true) {
            Set<String> keys = new HashSet<>(resolver.get());
            Attempt<T> attempt = this.<Attempt<T>>withLocks(keys, () -> {
                if (!keys.containsAll(resolver.get())) {
                    return Attempt.<T>retry();
                }
                return Attempt.of(action.get());
            });
            if (attempt.done()) {
                return attempt.value();
            }
        }
    }

    private record Attempt<T>(boolean done, T value) {

        static <T> Attempt<T> of(T value) {
            return new Attempt<>(true, value);
        }

        static <T> Attempt<T> retry() {
            return new Attempt<>(false, null);
        }
    }

    private int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }
}
