package com.tandemsystems.mailbox.config;

import com.tandemsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default mailbox provider selecting a creation strategy from the configured {@link MailboxType}.
 * A bounded configuration always gets a LINKED mailbox since the MPSC queue cannot be bounded.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxType.class);
        this.strategies.put(MailboxType.MPSC, new MpscStrategy<>());
        this.strategies.put(MailboxType.LINKED, new LinkedStrategy<>());
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        MailboxType type = effectiveConfig.getMailboxType() != null
                ? effectiveConfig.getMailboxType()
                : MailboxConfig.DEFAULT_MAILBOX_TYPE;

        if (effectiveConfig.isBounded() && type == MailboxType.MPSC) {
            logger.debug("Bounded mailbox requested, using LINKED instead of MPSC");
            type = MailboxType.LINKED;
        }
        return strategies.get(type).createMailbox(effectiveConfig);
    }
}
