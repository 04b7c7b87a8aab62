package com.theatre.internal;

import com.theatre.DeathLatch;
import com.theatre.TerminationFlag;
import com.theatre.TerminationMode;
import com.theatre.interpreter.InterpreterLifecycle;
import com.theatre.interpreter.SelfTerminatingInterpreter;
import com.theatre.mailbox.MailboxChannel;

import java.util.Objects;

/**
 * Worker for a {@link SelfTerminatingInterpreter}. Always stops with {@link TerminationMode#IMMEDIATE},
 * whether it was killed or terminated itself.
 *
 * @param <M> The type of messages the actor processes
 */
public final class SelfTerminatingWorker<M> extends ActorWorker<M> {

    private final SelfTerminatingInterpreter<M> interpreter;

    public SelfTerminatingWorker(String actorId,
                                 SelfTerminatingInterpreter<M> interpreter,
                                 MailboxChannel<M> channel,
                                 TerminationFlag terminationFlag,
                                 DeathLatch deathLatch) {
        super(actorId, channel, terminationFlag, deathLatch, TerminationMode.IMMEDIATE);
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter cannot be null");
    }

    @Override
    protected boolean interpret(M message) {
        return interpreter.interpret(message);
    }

    @Override
    protected InterpreterLifecycle<M> lifecycle() {
        return interpreter;
    }
}
