package com.theatre.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates the dedicated platform thread behind each actor.
 * Threads are named {@code <prefix>-<actorId>} for better identification in logs and profilers.
 */
public class WorkerThreadFactory {
    private static final Logger logger = LoggerFactory.getLogger(WorkerThreadFactory.class);

    public static final String DEFAULT_THREAD_PREFIX = "theatre";

    private String threadPrefix = DEFAULT_THREAD_PREFIX;
    // Forgotten actors must not keep the JVM alive
    private boolean daemon = true;
    private int priority = Thread.NORM_PRIORITY;

    /**
     * Creates a new, unstarted worker thread for an actor.
     *
     * @param actorId The ID of the actor the thread will serve
     * @param worker  The worker loop
     * @return an unstarted thread
     */
    public Thread newWorkerThread(String actorId, Runnable worker) {
        Objects.requireNonNull(worker, "worker cannot be null");
        Thread thread = new Thread(worker, threadPrefix + "-" + actorId);
        thread.setDaemon(daemon);
        thread.setPriority(priority);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.error("Worker thread {} of actor {} died unexpectedly", t.getName(), actorId, e));
        return thread;
    }

    public String getThreadPrefix() {
        return threadPrefix;
    }

    public WorkerThreadFactory setThreadPrefix(String threadPrefix) {
        if (threadPrefix == null || threadPrefix.isBlank()) {
            throw new IllegalArgumentException("Thread prefix cannot be blank");
        }
        this.threadPrefix = threadPrefix;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public WorkerThreadFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public int getPriority() {
        return priority;
    }

    public WorkerThreadFactory setPriority(int priority) {
        if (priority < Thread.MIN_PRIORITY || priority > Thread.MAX_PRIORITY) {
            throw new IllegalArgumentException("Thread priority out of range: " + priority);
        }
        this.priority = priority;
        return this;
    }
}
