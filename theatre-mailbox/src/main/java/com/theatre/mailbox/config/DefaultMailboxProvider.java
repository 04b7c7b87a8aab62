package com.theatre.mailbox.config;

import com.theatre.mailbox.LinkedMailbox;
import com.theatre.mailbox.Mailbox;
import com.theatre.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default mailbox provider that picks a {@link MailboxCreationStrategy} per {@link MailboxType}.
 *
 * - MPSC: {@link MpscMailbox} with the configured initial capacity as chunk size
 * - LINKED: {@link LinkedMailbox}
 *
 * @param <M> The message type
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies = new EnumMap<>(MailboxType.class);

    public DefaultMailboxProvider() {
        strategies.put(MailboxType.MPSC, config -> new MpscMailbox<>(config.getInitialCapacity()));
        strategies.put(MailboxType.LINKED, config -> new LinkedMailbox<>());
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        MailboxCreationStrategy<M> strategy = strategies.get(effectiveConfig.getMailboxType());
        if (strategy == null) {
            throw new IllegalArgumentException("Unsupported mailbox type: " + effectiveConfig.getMailboxType());
        }
        logger.debug("Creating mailbox for {}", effectiveConfig);
        return strategy.createMailbox(effectiveConfig);
    }
}
