package com.theatre.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Abstraction for the queue behind an actor mailbox.
 * The channel only relies on these operations, so the queue implementation can be swapped
 * through {@link com.theatre.mailbox.config.MailboxConfig}.
 *
 * <p>Mailboxes are unbounded: {@link #offer(Object)} only fails for a null message.
 * Any number of threads may offer, a single thread consumes.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message at the tail of this mailbox.
     *
     * @param message the message to add
     * @return true if the message was added
     * @throws NullPointerException if the message is null
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, waiting if necessary
     * until a message becomes available.
     *
     * @return the head of this mailbox
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Removes up to {@code maxElements} available messages from this mailbox and adds them
     * to the given collection, in mailbox order.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Returns the number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();
}
