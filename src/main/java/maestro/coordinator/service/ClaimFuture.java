package maestro.coordinator.service;

import maestro.coordinator.model.ClaimResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pending result of a claim that is waiting for work.
 * <p>
 * The queue engine reserves the future before handing it an item or a
 * "no work" result; a caller's {@link #cancel} only succeeds while nothing
 * is reserved. A cancel that loses that race returns false and the claim
 * stands.
 */
public final class ClaimFuture extends CompletableFuture<ClaimResult> {

    private static final int WAITING = 0;
    private static final int RESERVED = 1;
    private static final int CANCELLED = 2;

    private final AtomicInteger state = new AtomicInteger(WAITING);
    private volatile Runnable onCancel = () -> {
    };

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!state.compareAndSet(WAITING, CANCELLED)) {
            return false;
        }
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        onCancel.run();
        return cancelled;
    }

    /** Claim the right to complete this future. */
    boolean reserve() {
        return state.compareAndSet(WAITING, RESERVED);
    }

    void onCancel(Runnable action) {
        this.onCancel = action;
    }

    /** Complete immediately, used when no waiting is needed. */
    static ClaimFuture completed(ClaimResult result) {
        ClaimFuture future = new ClaimFuture();
        future.reserve();
        future.complete(result);
        return future;
    }
}
