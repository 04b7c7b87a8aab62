package com.theatre.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mailbox implementation using the JCTools MPSC (Multi-Producer Single-Consumer) unbounded queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing
 * - Minimal allocation overhead
 * - A lock that is only taken when the consumer actually waits
 *
 * Only one thread may call the consuming methods ({@link #poll()}, {@link #take()},
 * {@link #drainTo(Collection, int)}, {@link #clear()}). In Theatre that thread is the actor worker.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final int chunkSize;
    private volatile boolean hasWaitingConsumer = false;

    /**
     * Creates an MPSC mailbox with the default chunk size (128).
     */
    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size.
     * The queue is unbounded, the chunk size only controls how it grows.
     *
     * @param chunkSize the chunk size, rounded up to a power of two (at least 2)
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires a power of two of at least 2
        this.chunkSize = nextPowerOfTwo(Math.max(2, chunkSize));
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added) {
            signalNotEmpty();
        }
        return added;
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            hasWaitingConsumer = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            // Must be visible before the re-check below, see signalNotEmpty
            hasWaitingConsumer = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            hasWaitingConsumer = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (collection == this) {
            throw new IllegalArgumentException("Cannot drain to self");
        }

        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        return count;
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

    /**
     * Returns the chunk size the underlying queue grows by.
     *
     * @return the effective chunk size
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Signals the waiting consumer that a message is available.
     * Only acquires the lock if the consumer is actually waiting, so offers stay lock-free.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumer) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Rounds up to the next power of 2.
     */
    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        if ((value & (value - 1)) == 0) {
            return value;
        }
        return Integer.highestOneBit(value) << 1;
    }

    @Override
    public String toString() {
        return "MpscMailbox[size=" + queue.size() + ", chunkSize=" + chunkSize + "]";
    }
}
