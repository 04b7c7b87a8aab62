package com.theatre;

/**
 * Root of the exceptions thrown by the Theatre runtime.
 */
public class ActorException extends RuntimeException {

    /** The ID of the actor the exception relates to. */
    private final String actorId;

    /**
     * Creates a new ActorException with the specified detail message and actor ID.
     *
     * @param message the detail message
     * @param actorId the ID of the actor the exception relates to
     */
    public ActorException(String message, String actorId) {
        super(message);
        this.actorId = actorId;
    }

    /**
     * Creates a new ActorException with the specified detail message, cause, and actor ID.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param actorId the ID of the actor the exception relates to
     */
    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * Returns the ID of the actor the exception relates to.
     *
     * @return the actor ID, or null if not specified
     */
    public String getActorId() {
        return actorId;
    }
}
