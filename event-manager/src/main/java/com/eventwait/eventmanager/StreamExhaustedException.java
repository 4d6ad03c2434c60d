package com.eventwait.eventmanager;

/**
 * A closed {@link StreamingWaiter} has no queued events left.
 */
final class StreamExhaustedException extends EventManagerException {

    private static final long serialVersionUID = 1L;

    StreamExhaustedException(String eventName) {
        super("Streaming waiter for '" + eventName + "' is closed and drained");
    }
}
