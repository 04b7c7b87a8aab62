package com.theatre.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Mailbox backed by an unbounded {@link LinkedBlockingQueue}.
 * Uses separate put and take locks, which keeps producers and the consumer apart.
 *
 * Recommended for:
 * - Actors that are mostly idle, where blocking waits dominate
 * - Mixed workloads with few senders
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        return queue.drainTo(collection, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public String toString() {
        return "LinkedMailbox[size=" + queue.size() + "]";
    }
}
