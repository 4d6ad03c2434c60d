package com.eventwait.eventmanager;

/**
 * Inbound side of the {@link EventManager}: the entry point an event source calls once per
 * delivered notification.
 *
 * <p>Dispatching never blocks and does not buffer: an event dispatched while nobody waits for it
 * is dropped.
 */
public interface EventDispatcher {

    /**
     * Offers an event to every live subscription.
     *
     * @param eventName the event name, matched case-sensitively
     * @param args the event arguments, in order; individual values may be null
     * @throws NullPointerException if eventName or the args array is null
     */
    void dispatch(String eventName, Object... args);

    /**
     * Offers an event whose arguments are already packed into a tuple.
     *
     * @param eventName the event name, matched case-sensitively
     * @param args the event arguments
     * @throws NullPointerException if eventName or args is null
     */
    void dispatch(String eventName, EventArgs args);
}
