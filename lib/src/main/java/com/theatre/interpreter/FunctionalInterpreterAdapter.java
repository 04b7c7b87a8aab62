package com.theatre.interpreter;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Adapter that turns a plain {@link Consumer} into an {@link Interpreter}.
 *
 * @param <M> The type of messages this interpreter processes
 */
public class FunctionalInterpreterAdapter<M> implements Interpreter<M> {

    private final Consumer<? super M> messageHandler;

    /**
     * Creates a new adapter with the specified message handler function.
     *
     * @param messageHandler The function that handles messages
     */
    public FunctionalInterpreterAdapter(Consumer<? super M> messageHandler) {
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler cannot be null");
    }

    @Override
    public void interpret(M message) {
        messageHandler.accept(message);
    }

    /**
     * Creates a new interpreter from a message handling function.
     *
     * @param <M> The type of messages the interpreter processes
     * @param messageHandler The function that handles messages
     * @return A new interpreter
     */
    public static <M> FunctionalInterpreterAdapter<M> of(Consumer<? super M> messageHandler) {
        return new FunctionalInterpreterAdapter<>(messageHandler);
    }
}
