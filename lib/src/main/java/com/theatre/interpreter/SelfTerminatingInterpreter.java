package com.theatre.interpreter;

/**
 * Behavior of an actor that can stop itself after a message.
 * When {@link #interpret(Object)} returns true the actor discards its pending messages and dies.
 *
 * @param <M> The type of messages this interpreter processes
 */
@FunctionalInterface
public interface SelfTerminatingInterpreter<M> extends InterpreterLifecycle<M> {

    /**
     * Interprets one message.
     *
     * @param message The message to interpret
     * @return true to terminate the actor right after this message
     */
    boolean interpret(M message);
}
