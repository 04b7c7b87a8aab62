package com.theatre.mailbox.config;

import com.theatre.mailbox.Mailbox;

/**
 * Provides the mailbox behind each newly spawned actor.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox for the given configuration.
     *
     * @param config The mailbox configuration, or null for the defaults
     * @return a new, empty mailbox
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
