package com.tandemsystems.mailbox;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks the open/closed state of a mailbox together with the offers currently in flight.
 * A producer must {@link #enter()} before enqueuing and {@link #exit()} afterwards; once
 * {@link #close()} is visible, {@link #enter()} refuses. The consumer sees
 * {@link #isQuiescent()} only when no accepted offer can still land in the queue.
 */
final class CloseGuard {

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();

    boolean enter() {
        inFlight.incrementAndGet();
        if (closed.get()) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    void exit() {
        inFlight.decrementAndGet();
    }

    /**
     * @return true if this call closed the guard, false if it was already closed
     */
    boolean close() {
        return closed.compareAndSet(false, true);
    }

    boolean isClosed() {
        return closed.get();
    }

    // closed must be read before inFlight, see enter()
    boolean isQuiescent() {
        return closed.get() && inFlight.get() == 0;
    }
}
