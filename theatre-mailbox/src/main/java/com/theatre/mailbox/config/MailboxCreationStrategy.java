package com.theatre.mailbox.config;

import com.theatre.mailbox.Mailbox;

/**
 * Strategy interface for creating a mailbox of one {@link MailboxType}.
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
