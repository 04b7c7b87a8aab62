package com.theatre;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets any number of threads block until an actor's worker has stopped.
 * The latch moves from alive to dead exactly once and releases every current and future waiter.
 */
public final class DeathLatch {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition died = lock.newCondition();
    private boolean dead = false;

    /**
     * Marks the actor dead and wakes up all waiters. Later calls have no effect.
     *
     * @return true if this call performed the transition
     */
    public boolean markDead() {
        lock.lock();
        try {
            if (dead) {
                return false;
            }
            dead = true;
            died.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDead() {
        lock.lock();
        try {
            return dead;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the actor is dead. Returns immediately if it already is.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void await() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!dead) {
                died.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the actor is dead or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @param unit    the unit of the timeout
     * @return true if the actor is dead, false if the timeout elapsed first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!dead) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = died.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "DeathLatch[dead=" + isDead() + "]";
    }
}
