package com.tandemsystems.mailbox.config;

/**
 * Queue implementation behind a mailbox.
 */
public enum MailboxType {
    /**
     * JCTools MPSC queue. Always unbounded.
     */
    MPSC,

    /**
     * LinkedBlockingQueue. Bounded when {@link MailboxConfig#isBounded()} is set.
     */
    LINKED
}
