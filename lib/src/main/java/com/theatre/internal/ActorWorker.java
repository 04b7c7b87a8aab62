package com.theatre.internal;

import com.theatre.DeathLatch;
import com.theatre.TerminationFlag;
import com.theatre.TerminationMode;
import com.theatre.interpreter.InterpreterLifecycle;
import com.theatre.mailbox.Letter;
import com.theatre.mailbox.MailboxChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The loop run by an actor's dedicated thread: takes letters from the channel, hands messages to the
 * interpreter and carries out the termination protocol before reporting the actor dead.
 *
 * <p>States are {@code RUNNING -> DRAINING -> DEAD}. While running the worker blocks on the channel.
 * A {@link Letter.Stop}, a {@link Letter.Hangup}, a raised {@link TerminationFlag} seen after a
 * message, or a self-termination request moves it to draining, where the {@link TerminationMode}
 * decides whether pending messages are still interpreted. Whatever happens, the channel is closed
 * and the {@link DeathLatch} is released when the loop ends.
 *
 * <p>Subclasses own the interpreter. Only the thread executing {@link #run()} ever calls into it.
 *
 * @param <M> The type of messages the actor processes
 */
public abstract class ActorWorker<M> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ActorWorker.class);

    public enum State {
        RUNNING,
        DRAINING,
        DEAD
    }

    protected final String actorId;
    private final MailboxChannel<M> channel;
    private final TerminationFlag terminationFlag;
    private final DeathLatch deathLatch;
    private final TerminationMode mode;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile State state = State.RUNNING;

    protected ActorWorker(String actorId,
                          MailboxChannel<M> channel,
                          TerminationFlag terminationFlag,
                          DeathLatch deathLatch,
                          TerminationMode mode) {
        this.actorId = Objects.requireNonNull(actorId, "actorId cannot be null");
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.terminationFlag = Objects.requireNonNull(terminationFlag, "terminationFlag cannot be null");
        this.deathLatch = Objects.requireNonNull(deathLatch, "deathLatch cannot be null");
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    /**
     * Interprets one message.
     *
     * @param message The message to interpret
     * @return true if the interpreter asked to terminate the actor
     */
    protected abstract boolean interpret(M message);

    /**
     * Returns the lifecycle hooks of the owned interpreter.
     */
    protected abstract InterpreterLifecycle<M> lifecycle();

    @Override
    public final void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker of actor " + actorId + " is already running");
        }
        try {
            runHook("preStart", () -> lifecycle().preStart());
            TerminationMode drainMode = receiveUntilStopped();
            state = State.DRAINING;
            drain(drainMode);
        } finally {
            int discarded = channel.close();
            if (discarded > 0) {
                logger.debug("Actor {} discarded {} pending letters", actorId, discarded);
            }
            runHook("postStop", () -> lifecycle().postStop());
            state = State.DEAD;
            deathLatch.markDead();
            logger.info("Actor {} is dead", actorId);
        }
    }

    public State state() {
        return state;
    }

    public TerminationMode mode() {
        return mode;
    }

    public DeathLatch deathLatch() {
        return deathLatch;
    }

    private TerminationMode receiveUntilStopped() {
        while (true) {
            Letter<M> letter;
            try {
                letter = channel.receive();
            } catch (InterruptedException e) {
                logger.warn("Actor {} worker interrupted, stopping without draining", actorId);
                Thread.currentThread().interrupt();
                return TerminationMode.DISGRACEFUL;
            }

            if (letter instanceof Letter.Deliver<M> deliver) {
                if (interpretSafely(deliver.message())) {
                    logger.debug("Actor {} terminated itself", actorId);
                    return TerminationMode.IMMEDIATE;
                }
                if (terminationFlag.isRaised()) {
                    logger.debug("Actor {} observed kill request, stopping {}", actorId, mode);
                    return mode;
                }
            } else if (letter instanceof Letter.Stop) {
                logger.debug("Actor {} received stop, stopping {}", actorId, mode);
                return mode;
            } else {
                logger.debug("Actor {} has no strong handles left, stopping {}", actorId, mode);
                return mode;
            }
        }
    }

    private void drain(TerminationMode drainMode) {
        if (!drainMode.drainsMailbox()) {
            return;
        }
        int interpreted = 0;
        Letter<M> letter;
        while ((letter = channel.tryReceive()) != null) {
            if (letter instanceof Letter.Deliver<M> deliver) {
                interpreted++;
                if (interpretSafely(deliver.message())) {
                    break;
                }
            } else if (letter instanceof Letter.Hangup) {
                break;
            }
            // A stop found while draining is dropped
        }
        logger.debug("Actor {} drained {} pending messages", actorId, interpreted);
    }

    private boolean interpretSafely(M message) {
        try {
            return interpret(message);
        } catch (Throwable e) {
            logger.error("Actor {} error interpreting message: {}", actorId, message, e);
            runHook("onError", () -> lifecycle().onError(message, e));
            return false;
        }
    }

    private void runHook(String hook, Runnable action) {
        try {
            action.run();
        } catch (Throwable e) {
            logger.warn("Actor {} {} hook failed", actorId, hook, e);
        }
    }
}
