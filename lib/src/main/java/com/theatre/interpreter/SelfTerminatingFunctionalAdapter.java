package com.theatre.interpreter;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Adapter that turns a {@link Predicate} into a {@link SelfTerminatingInterpreter}.
 * The actor terminates after the first message the predicate accepts.
 *
 * @param <M> The type of messages this interpreter processes
 */
public class SelfTerminatingFunctionalAdapter<M> implements SelfTerminatingInterpreter<M> {

    private final Predicate<? super M> terminateAfter;

    public SelfTerminatingFunctionalAdapter(Predicate<? super M> terminateAfter) {
        this.terminateAfter = Objects.requireNonNull(terminateAfter, "terminateAfter cannot be null");
    }

    @Override
    public boolean interpret(M message) {
        return terminateAfter.test(message);
    }

    public static <M> SelfTerminatingFunctionalAdapter<M> of(Predicate<? super M> terminateAfter) {
        return new SelfTerminatingFunctionalAdapter<>(terminateAfter);
    }
}
