package com.theatre.mailbox;

import java.util.Objects;

/**
 * One entry of a {@link MailboxChannel}: either a user payload or a control marker.
 * Letters are consumed by the single receiver in the order they were sent.
 *
 * @param <M> The type of user messages
 */
public sealed interface Letter<M> permits Letter.Deliver, Letter.Stop, Letter.Hangup {

    /**
     * Wraps a user message.
     *
     * @param message the message to deliver
     * @param <M> The type of user messages
     * @return a new deliver letter
     */
    static <M> Letter<M> deliver(M message) {
        return new Deliver<>(message);
    }

    /**
     * A user payload to hand to the interpreter.
     *
     * @param message the payload, never null
     * @param <M> The type of user messages
     */
    record Deliver<M>(M message) implements Letter<M> {
        public Deliver {
            Objects.requireNonNull(message, "Message cannot be null");
        }
    }

    /**
     * Termination marker enqueued by a kill request.
     *
     * @param <M> The type of user messages
     */
    record Stop<M>() implements Letter<M> {
    }

    /**
     * Enqueued by the channel itself once the last strong sender has been released.
     *
     * @param <M> The type of user messages
     */
    record Hangup<M>() implements Letter<M> {
    }
}
