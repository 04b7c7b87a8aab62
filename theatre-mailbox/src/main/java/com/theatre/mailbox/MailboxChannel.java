package com.theatre.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unbounded multi-producer single-consumer channel of {@link Letter}s on top of a {@link Mailbox}.
 *
 * <p>The channel counts its strong {@link Sender}s. Once the last one is released the channel is
 * <em>hung up</em>: a {@link Letter.Hangup} wakes the receiver and every later send fails.
 * {@link WeakSender}s can send while the channel is open but do not keep it open.
 *
 * <p>Closing the channel is the receiver's side of the protocol: pending letters are discarded and
 * every later send fails. Only the receiving thread may call {@link #receive()},
 * {@link #tryReceive()} and {@link #close()}.
 *
 * @param <M> The type of user messages
 */
public final class MailboxChannel<M> {

    private static final Logger logger = LoggerFactory.getLogger(MailboxChannel.class);

    private final String name;
    private final Mailbox<Letter<M>> mailbox;
    private final AtomicInteger strongSenders = new AtomicInteger();
    private volatile boolean hungUp = false;
    private volatile boolean closed = false;

    /**
     * Creates a channel with no senders yet.
     *
     * @param name    The name used in log lines, usually the owning actor's id
     * @param mailbox The queue holding pending letters
     */
    public MailboxChannel(String name, Mailbox<Letter<M>> mailbox) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
    }

    /**
     * Opens the first strong sender of this channel.
     *
     * @return a new strong sender
     * @throws IllegalStateException if the channel is already hung up or closed
     */
    public Sender<M> openSender() {
        if (hungUp || closed) {
            throw new IllegalStateException("Channel " + name + " no longer accepts senders");
        }
        strongSenders.incrementAndGet();
        return new Sender<>(this);
    }

    /**
     * Creates a sender that does not keep this channel open.
     *
     * @return a new weak sender
     */
    public WeakSender<M> weakSender() {
        return new WeakSender<>(this);
    }

    /**
     * Blocks until a letter is available.
     *
     * @return the next letter
     * @throws InterruptedException if the receiving thread is interrupted while waiting
     */
    public Letter<M> receive() throws InterruptedException {
        return mailbox.take();
    }

    /**
     * Returns the next letter without blocking.
     *
     * @return the next letter, or null if none is pending
     */
    public Letter<M> tryReceive() {
        return mailbox.poll();
    }

    /**
     * Closes the receiving side. Later sends fail, pending letters are discarded.
     *
     * @return the number of discarded letters
     */
    public int close() {
        closed = true;
        int discarded = 0;
        while (mailbox.poll() != null) {
            discarded++;
        }
        if (discarded > 0) {
            logger.debug("Channel {} closed, {} pending letters discarded", name, discarded);
        }
        return discarded;
    }

    /**
     * Returns true once the receiving side has been closed.
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Returns true once the last strong sender has been released.
     */
    public boolean isHungUp() {
        return hungUp;
    }

    /**
     * Returns the number of strong senders that have not been released.
     */
    public int strongSenderCount() {
        return strongSenders.get();
    }

    /**
     * Returns the number of letters waiting in the mailbox.
     */
    public int pending() {
        return mailbox.size();
    }

    String name() {
        return name;
    }

    private boolean accepts() {
        return !hungUp && !closed;
    }

    private boolean enqueue(Letter<M> letter) {
        if (!accepts()) {
            return false;
        }
        return mailbox.offer(letter);
    }

    private void retain() {
        int current;
        do {
            current = strongSenders.get();
            if (current == 0) {
                throw new IllegalStateException("Channel " + name + " is hung up");
            }
        } while (!strongSenders.compareAndSet(current, current + 1));
    }

    private void releaseOne() {
        if (strongSenders.decrementAndGet() == 0) {
            hungUp = true;
            logger.debug("Channel {} hung up, last strong sender released", name);
            if (!closed) {
                mailbox.offer(new Letter.Hangup<>());
            }
        }
    }

    /**
     * Strong sending end of a channel. Keeps the channel open until {@link #release()} is called.
     *
     * @param <M> The type of user messages
     */
    public static final class Sender<M> {

        private final MailboxChannel<M> channel;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Sender(MailboxChannel<M> channel) {
            this.channel = channel;
        }

        /**
         * Enqueues a user message.
         *
         * @param message the message, never null
         * @return false if the channel no longer accepts letters
         * @throws IllegalStateException if this sender has been released
         */
        public boolean send(M message) {
            if (released.get()) {
                throw new IllegalStateException("Sender of channel " + channel.name() + " has been released");
            }
            return channel.enqueue(Letter.deliver(message));
        }

        /**
         * Enqueues a termination marker. Allowed on a released sender.
         *
         * @return false if the channel no longer accepts letters
         */
        public boolean sendStop() {
            return channel.enqueue(new Letter.Stop<>());
        }

        /**
         * Creates another strong sender on the same channel.
         *
         * @return a new strong sender
         * @throws IllegalStateException if this sender has been released
         */
        public Sender<M> duplicate() {
            if (released.get()) {
                throw new IllegalStateException("Sender of channel " + channel.name() + " has been released");
            }
            channel.retain();
            return new Sender<>(channel);
        }

        /**
         * Creates a weak sender on the same channel.
         *
         * @return a new weak sender
         */
        public WeakSender<M> weaken() {
            return new WeakSender<>(channel);
        }

        /**
         * Releases this sender. Only the first call has an effect.
         *
         * @return true if this call released the sender
         */
        public boolean release() {
            if (released.compareAndSet(false, true)) {
                channel.releaseOne();
                return true;
            }
            return false;
        }

        public boolean isReleased() {
            return released.get();
        }
    }

    /**
     * Sending end that does not count towards keeping the channel open.
     *
     * @param <M> The type of user messages
     */
    public static final class WeakSender<M> {

        private final MailboxChannel<M> channel;

        private WeakSender(MailboxChannel<M> channel) {
            this.channel = channel;
        }

        /**
         * Enqueues a user message.
         *
         * @param message the message, never null
         * @return false if the channel no longer accepts letters
         */
        public boolean send(M message) {
            return channel.enqueue(Letter.deliver(message));
        }
    }
}
