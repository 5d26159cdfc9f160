package com.tandemsystems.mailbox.config;

import com.tandemsystems.mailbox.LinkedMailbox;
import com.tandemsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link LinkedMailbox} instances, bounded at the configured max capacity when requested.
 *
 * @param <M> The message type
 */
public class LinkedStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        if (config.isBounded()) {
            logger.debug("Creating bounded LinkedMailbox with capacity: {}", config.getMaxCapacity());
            return new LinkedMailbox<>(config.getMaxCapacity());
        }
        logger.debug("Creating unbounded LinkedMailbox");
        return new LinkedMailbox<>();
    }
}
