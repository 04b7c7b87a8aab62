package com.theatre;

import com.theatre.config.ActorConfig;
import com.theatre.interpreter.Interpreter;
import com.theatre.interpreter.SelfTerminatingInterpreter;
import com.theatre.internal.ActorWorker;
import com.theatre.internal.InterpretingWorker;
import com.theatre.internal.SelfTerminatingWorker;
import com.theatre.mailbox.Letter;
import com.theatre.mailbox.Mailbox;
import com.theatre.mailbox.MailboxChannel;
import com.theatre.mailbox.config.DefaultMailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Strong handle to an actor: a single background thread interpreting the messages of a private,
 * unbounded mailbox.
 *
 * <p>A handle can send messages ({@link #tell(Object)}), request termination ({@link #kill()}) and
 * wait for the actor to die ({@link #join()}). {@link #duplicate()} creates another strong handle on
 * the same actor, {@link #weak()} a send-only one. Handles are thread-safe.
 *
 * <p>Every strong handle keeps the mailbox open. Releasing a handle, through {@link #close()},
 * {@link #join()} or by letting it become unreachable, gives up that right. Once the last strong
 * handle is released the actor stops on its own, with the termination mode it was spawned with.
 *
 * <pre>{@code
 * Actor<String> actor = Actor.graceful(new Echo<>());
 * actor.tell("Hello, World!");
 * actor.kill();
 * actor.join();
 * }</pre>
 *
 * @param <M> The type of messages the actor processes
 */
public final class Actor<M> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final String actorId;
    private final MailboxChannel.Sender<M> sender;
    private final TerminationFlag terminationFlag;
    private final DeathLatch deathLatch;
    private final Cleaner.Cleanable cleanable;

    private Actor(String actorId,
                  MailboxChannel.Sender<M> sender,
                  TerminationFlag terminationFlag,
                  DeathLatch deathLatch) {
        this.actorId = actorId;
        this.sender = sender;
        this.terminationFlag = terminationFlag;
        this.deathLatch = deathLatch;
        // Must not capture this, or the handle would never become unreachable
        this.cleanable = CLEANER.register(this, sender::release);
    }

    /**
     * Spawns an actor that interprets every message still queued before dying.
     *
     * @param interpreter The interpreter, owned by the actor from now on
     * @param <M> The type of messages
     * @return the first handle to the new actor
     */
    public static <M> Actor<M> graceful(Interpreter<M> interpreter) {
        return graceful(interpreter, ActorConfig.defaults());
    }

    public static <M> Actor<M> graceful(Interpreter<M> interpreter, ActorConfig config) {
        return spawn(interpreter, config, TerminationMode.GRACEFUL);
    }

    /**
     * Spawns an actor that discards queued messages once it has been told to die.
     *
     * @param interpreter The interpreter, owned by the actor from now on
     * @param <M> The type of messages
     * @return the first handle to the new actor
     */
    public static <M> Actor<M> disgraceful(Interpreter<M> interpreter) {
        return disgraceful(interpreter, ActorConfig.defaults());
    }

    public static <M> Actor<M> disgraceful(Interpreter<M> interpreter, ActorConfig config) {
        return spawn(interpreter, config, TerminationMode.DISGRACEFUL);
    }

    /**
     * Spawns an actor whose interpreter can end it after any message. Queued messages are discarded
     * when it dies, whether it terminated itself or was killed.
     *
     * @param interpreter The interpreter, owned by the actor from now on
     * @param <M> The type of messages
     * @return the first handle to the new actor
     */
    public static <M> Actor<M> selfTerminating(SelfTerminatingInterpreter<M> interpreter) {
        return selfTerminating(interpreter, ActorConfig.defaults());
    }

    public static <M> Actor<M> selfTerminating(SelfTerminatingInterpreter<M> interpreter, ActorConfig config) {
        Objects.requireNonNull(interpreter, "interpreter cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        String actorId = config.resolveActorId();
        MailboxChannel<M> channel = openChannel(actorId, config);
        TerminationFlag flag = new TerminationFlag();
        DeathLatch latch = new DeathLatch();
        return start(actorId, config, channel, flag,
                new SelfTerminatingWorker<>(actorId, interpreter, channel, flag, latch));
    }

    private static <M> Actor<M> spawn(Interpreter<M> interpreter, ActorConfig config, TerminationMode mode) {
        Objects.requireNonNull(interpreter, "interpreter cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        String actorId = config.resolveActorId();
        MailboxChannel<M> channel = openChannel(actorId, config);
        TerminationFlag flag = new TerminationFlag();
        DeathLatch latch = new DeathLatch();
        return start(actorId, config, channel, flag,
                new InterpretingWorker<>(actorId, interpreter, channel, flag, latch, mode));
    }

    private static <M> MailboxChannel<M> openChannel(String actorId, ActorConfig config) {
        Mailbox<Letter<M>> mailbox = new DefaultMailboxProvider<Letter<M>>()
                .createMailbox(config.getMailboxConfig());
        return new MailboxChannel<>(actorId, mailbox);
    }

    private static <M> Actor<M> start(String actorId,
                                      ActorConfig config,
                                      MailboxChannel<M> channel,
                                      TerminationFlag flag,
                                      ActorWorker<M> worker) {
        Actor<M> actor = new Actor<>(actorId, channel.openSender(), flag, worker.deathLatch());
        config.getThreadFactory().newWorkerThread(actorId, worker).start();
        logger.info("Actor {} started, termination mode {}", actorId, worker.mode());
        return actor;
    }

    /**
     * Sends a message to the actor. Never blocks.
     *
     * @param message The message, never null
     * @throws DeadActorException    if the actor no longer accepts messages
     * @throws IllegalStateException if this handle has been released
     */
    public void tell(M message) {
        Objects.requireNonNull(message, "Message cannot be null");
        requireNotReleased();
        if (!sender.send(message)) {
            throw new DeadActorException(actorId, message);
        }
    }

    /**
     * Asks the actor to terminate. Messages already being interpreted complete first; what happens to
     * queued messages depends on the actor's termination mode. Never blocks and never fails: killing
     * a dying or dead actor has no effect.
     */
    public void kill() {
        if (terminationFlag.raise()) {
            logger.debug("Kill requested for actor {}", actorId);
            sender.sendStop();
        }
    }

    /**
     * Releases this handle, then blocks until the actor is dead.
     * Returns at once if the actor is already dead.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void join() throws InterruptedException {
        release();
        deathLatch.await();
    }

    /**
     * Releases this handle, then waits at most the given time for the actor to die.
     *
     * @param timeout the maximum time to wait
     * @param unit    the unit of the timeout
     * @return true if the actor is dead, false if it was still alive when the timeout elapsed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean join(long timeout, TimeUnit unit) throws InterruptedException {
        release();
        return deathLatch.await(timeout, unit);
    }

    /**
     * Releases this handle without waiting for the actor. Later calls have no effect.
     */
    @Override
    public void close() {
        release();
    }

    /**
     * Creates another strong handle on the same actor.
     *
     * @return a new handle
     * @throws IllegalStateException if this handle has been released
     */
    public Actor<M> duplicate() {
        requireNotReleased();
        return new Actor<>(actorId, sender.duplicate(), terminationFlag, deathLatch);
    }

    /**
     * Creates a send-only handle on the same actor. Weak handles cannot kill or join the actor and
     * do not keep it alive.
     *
     * @return a new weak handle
     * @throws IllegalStateException if this handle has been released
     */
    public WeakActor<M> weak() {
        requireNotReleased();
        return new WeakActor<>(actorId, sender.weaken());
    }

    public String id() {
        return actorId;
    }

    /**
     * Returns true once the actor's worker has stopped.
     */
    public boolean isDead() {
        return deathLatch.isDead();
    }

    /**
     * Returns true once this handle has been released by {@link #close()} or {@link #join()}.
     */
    public boolean isReleased() {
        return sender.isReleased();
    }

    private void release() {
        cleanable.clean();
    }

    private void requireNotReleased() {
        if (sender.isReleased()) {
            throw new IllegalStateException("Handle to actor " + actorId + " has been released");
        }
    }

    @Override
    public String toString() {
        return "Actor[" + actorId + (isDead() ? ", dead" : "") + "]";
    }
}
