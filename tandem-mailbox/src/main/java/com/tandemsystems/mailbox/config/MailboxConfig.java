package com.tandemsystems.mailbox.config;

/**
 * Configuration for actor mailbox settings.
 * The default is an unbounded MPSC mailbox, matching the behavior of a plain
 * unbounded channel. Setting {@link #setBounded(boolean)} switches to a bounded
 * {@link MailboxType#LINKED} mailbox whose senders wait for free space.
 */
public class MailboxConfig {
    public static final int DEFAULT_INITIAL_CAPACITY = 128;
    public static final int DEFAULT_MAX_CAPACITY = 10_000;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 50;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.MPSC;

    private int initialCapacity;
    private int maxCapacity;
    private boolean bounded;
    private long pollTimeoutMillis;
    private MailboxType mailboxType;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
        this.maxCapacity = DEFAULT_MAX_CAPACITY;
        this.bounded = false;
        this.pollTimeoutMillis = DEFAULT_POLL_TIMEOUT_MS;
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
    }

    /**
     * Sets the initial capacity (chunk size for MPSC mailboxes).
     *
     * @param initialCapacity The initial capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialCapacity(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Sets the capacity used when the mailbox is bounded.
     *
     * @param maxCapacity The maximum capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMaxCapacity(int maxCapacity) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("Max capacity must be positive: " + maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        return this;
    }

    /**
     * Enables or disables the bounded mode.
     *
     * @param bounded true to bound the mailbox at {@link #getMaxCapacity()}
     * @return This MailboxConfig instance
     */
    public MailboxConfig setBounded(boolean bounded) {
        this.bounded = bounded;
        return this;
    }

    /**
     * Sets how long the worker waits for a message before re-checking its state.
     *
     * @param pollTimeoutMillis The poll timeout in milliseconds
     * @return This MailboxConfig instance
     */
    public MailboxConfig setPollTimeoutMillis(long pollTimeoutMillis) {
        if (pollTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Poll timeout must be positive: " + pollTimeoutMillis);
        }
        this.pollTimeoutMillis = pollTimeoutMillis;
        return this;
    }

    /**
     * Sets the queue implementation.
     *
     * @param mailboxType The mailbox type
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public boolean isBounded() {
        return bounded;
    }

    public long getPollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
                "type=" + mailboxType +
                ", initialCapacity=" + initialCapacity +
                ", maxCapacity=" + maxCapacity +
                ", bounded=" + bounded +
                ", pollTimeoutMillis=" + pollTimeoutMillis +
                '}';
    }
}
