package com.theatre.mailbox.config;

import java.util.Objects;

/**
 * Configuration for actor mailboxes. Mailboxes are always unbounded,
 * the initial capacity only sizes the first chunk of an {@link MailboxType#MPSC} queue.
 */
public class MailboxConfig {
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.MPSC;
    public static final int DEFAULT_INITIAL_CAPACITY = 128;

    private MailboxType mailboxType;
    private int initialCapacity;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
    }

    /**
     * Sets the mailbox type.
     *
     * @param mailboxType The mailbox type
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType cannot be null");
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * Sets the initial capacity for the mailbox.
     *
     * @param initialCapacity The initial capacity, must be positive
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialCapacity(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    @Override
    public String toString() {
        return "MailboxConfig{mailboxType=" + mailboxType + ", initialCapacity=" + initialCapacity + "}";
    }
}
