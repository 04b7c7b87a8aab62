package com.theatre.mailbox.config;

/**
 * The queue implementations an actor mailbox can be built on.
 */
public enum MailboxType {
    /**
     * JCTools MPSC queue. Lock-free sends, best for actors with many senders.
     */
    MPSC,

    /**
     * {@link java.util.concurrent.LinkedBlockingQueue}. Good general-purpose choice for mostly idle actors.
     */
    LINKED
}
