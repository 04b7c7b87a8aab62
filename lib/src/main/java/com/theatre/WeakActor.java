package com.theatre;

import com.theatre.mailbox.MailboxChannel;

import java.util.Objects;

/**
 * Send-only handle to an actor, obtained from {@link Actor#weak()}.
 * It can neither kill nor join the actor, and it does not keep the actor's mailbox open:
 * once every strong handle is released, telling through a weak handle fails.
 *
 * @param <M> The type of messages the actor processes
 */
public final class WeakActor<M> {

    private final String actorId;
    private final MailboxChannel.WeakSender<M> sender;

    WeakActor(String actorId, MailboxChannel.WeakSender<M> sender) {
        this.actorId = actorId;
        this.sender = sender;
    }

    /**
     * Sends a message to the actor. Never blocks.
     *
     * @param message The message, never null
     * @throws DeadActorException if the actor no longer accepts messages
     */
    public void tell(M message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (!sender.send(message)) {
            throw new DeadActorException(actorId, message);
        }
    }

    public String id() {
        return actorId;
    }

    @Override
    public String toString() {
        return "WeakActor[" + actorId + "]";
    }
}
