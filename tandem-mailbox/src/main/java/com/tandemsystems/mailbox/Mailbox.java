package com.tandemsystems.mailbox;

import java.util.concurrent.TimeUnit;

/**
 * Abstraction for actor mailbox operations.
 * A mailbox is the only object shared between the handles of an actor (producers)
 * and its worker (the single consumer). Implementations must be safe for many
 * concurrent producers and one consumer, and must neither lose nor duplicate a
 * message accepted while the mailbox is open.
 *
 * <p>A mailbox can be closed. After {@link #close()} returns, every offer fails,
 * while messages accepted before the close stay available to the consumer until
 * drained. {@link #isDrained()} tells the consumer when nothing more can arrive.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message into this mailbox if it is possible to do
     * so immediately without exceeding capacity, returning true upon success
     * and false if the mailbox is full or closed.
     *
     * @param message the message to add
     * @return true if the message was added, false otherwise
     */
    boolean offer(T message);

    /**
     * Inserts the specified message into this mailbox, waiting up to the
     * specified wait time if necessary for space to become available.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if successful, false if the timeout elapsed or the mailbox is closed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Closes this mailbox for producers. Idempotent.
     */
    void close();

    /**
     * Returns true once {@link #close()} has been called.
     *
     * @return true if closed
     */
    boolean isClosed();

    /**
     * Returns true when the mailbox is closed, no offer is still in progress
     * and no message is left. Once true it stays true.
     *
     * @return true if the consumer has nothing left to receive
     */
    boolean isDrained();
}
