package com.eventwait.eventmanager;

/**
 * Thrown when registering with, or still waiting on, an {@link EventManager} that has been closed.
 */
public class EventManagerClosedException extends EventManagerException {

    private static final long serialVersionUID = 1L;

    public EventManagerClosedException(String message) {
        super(message);
    }
}
