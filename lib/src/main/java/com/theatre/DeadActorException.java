package com.theatre;

/**
 * Thrown by {@code tell} when the actor's mailbox no longer accepts messages,
 * because the actor is dead or dying. A dead actor stays dead, so retrying is pointless.
 */
public class DeadActorException extends ActorException {

    private final transient Object undeliveredMessage;

    public DeadActorException(String actorId, Object undeliveredMessage) {
        super("Actor " + actorId + " is dead, message was not delivered", actorId);
        this.undeliveredMessage = undeliveredMessage;
    }

    /**
     * Returns the message that could not be delivered, handing it back to the sender.
     *
     * @return the undelivered message
     */
    public Object getUndeliveredMessage() {
        return undeliveredMessage;
    }
}
