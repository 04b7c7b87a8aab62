package com.theatre.config;

import com.theatre.mailbox.config.MailboxConfig;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Configuration used when spawning an actor.
 * Unset values fall back to defaults: a generated name, an MPSC mailbox and daemon worker threads.
 */
public class ActorConfig {
    private static final AtomicLong ACTOR_COUNTER = new AtomicLong();

    private String name;
    private MailboxConfig mailboxConfig = new MailboxConfig();
    private WorkerThreadFactory threadFactory = new WorkerThreadFactory();

    /**
     * Creates a configuration with default values.
     *
     * @return a new configuration
     */
    public static ActorConfig defaults() {
        return new ActorConfig();
    }

    /**
     * Sets the name used as actor id in thread names and log lines.
     * Names do not need to be unique.
     *
     * @param name The actor name
     * @return This ActorConfig instance
     */
    public ActorConfig setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Actor name cannot be blank");
        }
        this.name = name;
        return this;
    }

    public String getName() {
        return name;
    }

    public ActorConfig setMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = Objects.requireNonNull(mailboxConfig, "mailboxConfig cannot be null");
        return this;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public ActorConfig setThreadFactory(WorkerThreadFactory threadFactory) {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory cannot be null");
        return this;
    }

    public WorkerThreadFactory getThreadFactory() {
        return threadFactory;
    }

    /**
     * Returns the configured name, or generates a fresh {@code actor-N} id.
     *
     * @return the id of the actor about to be spawned
     */
    public String resolveActorId() {
        return name != null ? name : "actor-" + ACTOR_COUNTER.incrementAndGet();
    }
}
