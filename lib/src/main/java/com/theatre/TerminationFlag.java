package com.theatre;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared termination request of one actor. Raised by any strong handle, read by the worker
 * between two message deliveries. Once raised it stays raised.
 */
public final class TerminationFlag {

    private final AtomicBoolean raised = new AtomicBoolean(false);

    /**
     * Raises the flag.
     *
     * @return true if this call raised it, false if it was already raised
     */
    public boolean raise() {
        return raised.compareAndSet(false, true);
    }

    public boolean isRaised() {
        return raised.get();
    }

    @Override
    public String toString() {
        return "TerminationFlag[raised=" + raised.get() + "]";
    }
}
