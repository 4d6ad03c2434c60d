package com.eventwait.eventmanager;

/**
 * Base exception for failures surfaced by the {@link EventManager}.
 */
public class EventManagerException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public EventManagerException(String message) {
        super(message);
    }
    
    public EventManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
