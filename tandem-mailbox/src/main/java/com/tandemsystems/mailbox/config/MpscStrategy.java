package com.tandemsystems.mailbox.config;

import com.tandemsystems.mailbox.Mailbox;
import com.tandemsystems.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates unbounded {@link MpscMailbox} instances.
 *
 * @param <M> The message type
 */
public class MpscStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(MpscStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating MpscMailbox with initial chunk size: {}", config.getInitialCapacity());
        return new MpscMailbox<>(config.getInitialCapacity());
    }
}
