package io.seriesfetch.budget;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Budget governs how much upstream capacity sub-requests may consume.
 * Each admitted call holds a {@link Permit} that must be settled exactly once: {@link #complete} when the call
 * succeeded, {@link #release} when it failed or was cancelled.
 */
public interface Budget {
    /** Block until a call of the given estimated cost may start. Fails fast when waiting cannot help. */
    Permit admit(long estimatedCost) throws InterruptedException;

    /** Charge the permit's cost to the consumed counters and free its slot. */
    void complete(Permit permit);

    /** Free the permit's slot without charging anything. */
    void release(Permit permit);

    final class Permit {
        private final long cost;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        public Permit(long cost) { this.cost = cost; }

        public long cost() { return cost; }

        boolean settle() { return settled.compareAndSet(false, true); }

        public boolean isSettled() { return settled.get(); }
    }
}
