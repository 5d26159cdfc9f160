package com.tandemsystems.mailbox.config;

import com.tandemsystems.mailbox.Mailbox;

/**
 * Strategy interface for creating mailboxes from configuration.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param config The mailbox configuration
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
