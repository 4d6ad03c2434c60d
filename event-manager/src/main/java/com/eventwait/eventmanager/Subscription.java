package com.eventwait.eventmanager;

/**
 * A live registration of interest in future events of one name.
 *
 * <p>Implementations share the matching rule of {@link EventMatcher} and differ in what they do
 * with a match: a {@link OneShotWaiter} releases one blocked caller, a {@link StreamingWaiter}
 * buffers every match for a consumer.
 */
public interface Subscription {

    /**
     * @return the event name this subscription listens for
     */
    String getEventName();

    /**
     * Evaluates whether a dispatched event satisfies this subscription, without acting on it.
     *
     * @param eventName the dispatched event name
     * @param args the dispatched arguments
     * @return true if the name is equal and the predicate, if any, accepts the arguments
     */
    boolean matches(String eventName, EventArgs args);

    /**
     * Offers a dispatched event to this subscription. Called by the manager for every event;
     * must not block.
     *
     * @param eventName the dispatched event name
     * @param args the dispatched arguments
     * @return true if the event matched and was accepted
     */
    boolean process(String eventName, EventArgs args);

    /**
     * Removes this subscription from its manager. After calling this method, no further events
     * are offered to it.
     *
     * This method is idempotent - calling it multiple times has no additional effect.
     */
    void unsubscribe();

    /**
     * Checks if this subscription is still registered.
     *
     * @return true if the subscription is active, false if it has been unsubscribed
     */
    boolean isActive();
}
