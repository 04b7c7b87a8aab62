package com.theatre.interpreter;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Sample interpreter printing every message on its own line.
 *
 * @param <M> The type of messages this interpreter processes
 */
public class Echo<M> implements Interpreter<M> {

    private final PrintStream out;

    /**
     * Creates an echo writing to standard output.
     */
    public Echo() {
        this(System.out);
    }

    public Echo(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    @Override
    public void interpret(M message) {
        out.println(message);
    }
}
