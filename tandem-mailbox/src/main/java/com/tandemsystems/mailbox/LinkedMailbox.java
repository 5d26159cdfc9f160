package com.tandemsystems.mailbox;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Mailbox implementation using LinkedBlockingQueue.
 *
 * Recommended for:
 * - Actors that need a bounded mailbox (senders wait for space)
 * - General-purpose use where the JCTools queue is not wanted
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue;
    private final CloseGuard guard = new CloseGuard();

    /**
     * Creates an unbounded mailbox.
     */
    public LinkedMailbox() {
        this.queue = new LinkedBlockingQueue<>();
    }

    /**
     * Creates a bounded mailbox with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (!guard.enter()) {
            return false;
        }
        try {
            return queue.offer(message);
        } finally {
            guard.exit();
        }
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (!guard.enter()) {
            return false;
        }
        try {
            return queue.offer(message, timeout, unit);
        } finally {
            guard.exit();
        }
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public void close() {
        guard.close();
    }

    @Override
    public boolean isClosed() {
        return guard.isClosed();
    }

    @Override
    public boolean isDrained() {
        return guard.isQuiescent() && queue.isEmpty();
    }
}
