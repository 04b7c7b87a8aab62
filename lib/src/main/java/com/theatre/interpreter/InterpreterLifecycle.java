package com.theatre.interpreter;

/**
 * Lifecycle hooks shared by both interpreter shapes.
 * All hooks run on the actor's worker thread, never concurrently with message interpretation.
 *
 * @param <M> The type of messages this interpreter processes
 */
public interface InterpreterLifecycle<M> {

    /**
     * Called once before the first message is interpreted.
     */
    default void preStart() {
        // Default implementation does nothing
    }

    /**
     * Called when interpreting a message threw. The actor keeps running afterwards.
     *
     * @param message   The message that failed
     * @param exception The failure
     */
    default void onError(M message, Throwable exception) {
        // Default implementation does nothing
    }

    /**
     * Called once after the last message, before the actor is reported dead.
     */
    default void postStop() {
        // Default implementation does nothing
    }
}
