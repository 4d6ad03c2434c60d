package com.eventwait.eventmanager;

import java.time.Duration;

/**
 * Thrown by {@link EventManager#waitFor} when the timeout elapses before a matching event is
 * dispatched.
 *
 * <p>The waiter has already been deregistered when this is thrown; callers may simply call
 * {@code waitFor} again to retry.
 */
public class WaitTimeoutException extends EventManagerException {

    private static final long serialVersionUID = 1L;

    private final String eventName;
    private final Duration timeout;

    public WaitTimeoutException(String eventName, Duration timeout) {
        super(String.format("waitFor('%s') timed out after %d ms while waiting for an event",
            eventName, timeout.toMillis()));
        this.eventName = eventName;
        this.timeout = timeout;
    }

    public String getEventName() {
        return eventName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
