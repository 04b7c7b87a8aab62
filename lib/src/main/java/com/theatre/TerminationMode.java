package com.theatre;

/**
 * What the worker does with letters still queued once it has decided to stop.
 */
public enum TerminationMode {
    /**
     * Interpret every message still pending, then die.
     */
    GRACEFUL,

    /**
     * Discard pending messages and die promptly.
     */
    DISGRACEFUL,

    /**
     * Discard pending messages and die promptly. Used by actors that stop themselves.
     */
    IMMEDIATE;

    /**
     * Returns true if pending messages are interpreted before dying.
     */
    public boolean drainsMailbox() {
        return this == GRACEFUL;
    }
}
