package com.eventwait.eventmanager;

/**
 * Terminal condition of an {@link EventStream} whose wait timed out.
 *
 * <p>Thrown only after every event buffered before the timeout has been delivered.
 */
public class LoopTimeoutException extends EventManagerException {

    private static final long serialVersionUID = 1L;

    private final String eventName;
    private final long deliveredCount;

    public LoopTimeoutException(String eventName, long deliveredCount) {
        super(String.format("loopFor('%s') timed out while waiting for an event (%d delivered)",
            eventName, deliveredCount));
        this.eventName = eventName;
        this.deliveredCount = deliveredCount;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * @return how many events the stream yielded before timing out
     */
    public long getDeliveredCount() {
        return deliveredCount;
    }
}
