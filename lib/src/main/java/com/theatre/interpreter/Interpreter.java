package com.theatre.interpreter;

/**
 * Behavior of an actor that never asks to stop on its own.
 * Only the actor's worker thread ever calls an interpreter, so implementations
 * may keep unsynchronized mutable state.
 *
 * <p>Example:
 * <pre>{@code
 * Actor<String> actor = Actor.graceful(message -> System.out.println("Got " + message));
 * }</pre>
 *
 * @param <M> The type of messages this interpreter processes
 */
@FunctionalInterface
public interface Interpreter<M> extends InterpreterLifecycle<M> {

    /**
     * Interprets one message.
     *
     * @param message The message to interpret
     */
    void interpret(M message);
}
