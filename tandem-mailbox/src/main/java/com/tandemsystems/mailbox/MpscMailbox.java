package com.tandemsystems.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 * This is the default actor mailbox.
 *
 * This implementation provides:
 * - Lock-free message enqueuing (offer operations)
 * - Minimal allocation overhead
 * - No backpressure: a slow worker with a fast producer grows memory without limit
 *
 * Trade-offs:
 * - Uses more memory than LinkedBlockingQueue (array-based with chunking)
 * - Blocking poll with timeout uses a lock for waiting
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private final MpscUnboundedArrayQueue<T> queue;
    private final CloseGuard guard = new CloseGuard();
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private volatile boolean hasWaitingConsumers = false;

    /**
     * Creates an MPSC mailbox with default chunk size (128).
     */
    public MpscMailbox() {
        this(128);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size.
     *
     * Note: This is unbounded - the initial capacity is just the chunk size.
     * The queue will grow automatically.
     *
     * @param chunkSize the chunk size, rounded up to a power of 2
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires at least 2
        int safeCapacity = chunkSize <= 1 ? 2 : chunkSize;
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(safeCapacity));
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (!guard.enter()) {
            return false;
        }
        boolean added;
        try {
            added = queue.offer(message);
        } finally {
            guard.exit();
        }
        if (added) {
            signalNotEmpty();
        }
        return added;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) {
        // never full, so the timeout is irrelevant
        return offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            hasWaitingConsumers = true;
            long deadline = System.nanoTime() + nanos;
            while (nanos > 0) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (guard.isQuiescent()) {
                    return null;
                }
                notEmpty.awaitNanos(nanos);
                nanos = deadline - System.nanoTime();
            }
            return queue.poll();
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (guard.close()) {
            // wake a consumer parked in poll so it can observe the close
            lock.lock();
            try {
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public boolean isClosed() {
        return guard.isClosed();
    }

    @Override
    public boolean isDrained() {
        return guard.isQuiescent() && queue.isEmpty();
    }

    /**
     * Signals waiting consumers that a message is available.
     * Only acquires the lock if a consumer is actually waiting.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumers) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
