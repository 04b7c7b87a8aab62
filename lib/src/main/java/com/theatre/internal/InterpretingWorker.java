package com.theatre.internal;

import com.theatre.DeathLatch;
import com.theatre.TerminationFlag;
import com.theatre.TerminationMode;
import com.theatre.interpreter.Interpreter;
import com.theatre.interpreter.InterpreterLifecycle;
import com.theatre.mailbox.MailboxChannel;

import java.util.Objects;

/**
 * Worker for an {@link Interpreter}, which never asks to stop on its own.
 *
 * @param <M> The type of messages the actor processes
 */
public final class InterpretingWorker<M> extends ActorWorker<M> {

    private final Interpreter<M> interpreter;

    public InterpretingWorker(String actorId,
                              Interpreter<M> interpreter,
                              MailboxChannel<M> channel,
                              TerminationFlag terminationFlag,
                              DeathLatch deathLatch,
                              TerminationMode mode) {
        super(actorId, channel, terminationFlag, deathLatch, mode);
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter cannot be null");
    }

    @Override
    protected boolean interpret(M message) {
        interpreter.interpret(message);
        return false;
    }

    @Override
    protected InterpreterLifecycle<M> lifecycle() {
        return interpreter;
    }
}
