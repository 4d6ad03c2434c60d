package com.eventwait.eventmanager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates dispatched events with callers waiting for them.
 *
 * <p>An event source feeds every inbound notification to {@link #dispatch(String, Object...)}.
 * Callers block until a matching event arrives, either once with {@link #waitFor} or repeatedly
 * with {@link #loopFor}. A subscription only sees events dispatched while it is registered;
 * nothing is buffered on behalf of callers that are not waiting yet.
 *
 * <p>Thread-safety guarantees:
 * <ul>
 *   <li>The registry is a {@link CopyOnWriteArrayList}: registration order is preserved, dispatch
 *       iterates a stable snapshot and never blocks, registration and removal are atomic.</li>
 *   <li>Every subscription registered when {@code dispatch} starts sees the event before
 *       {@code dispatch} returns, in registration order. One event may satisfy many waits.</li>
 *   <li>Waiting callers block on their own threads; dispatching may happen on any thread.</li>
 * </ul>
 *
 * <p>One instance usually serves one client session and is passed explicitly to whatever needs to
 * dispatch or wait. Closing it releases every blocked caller.
 *
 * <p>Usage example:
 * <pre>{@code
 * EventManager events = new EventManager();
 *
 * // event source thread
 * events.dispatch("on_message", channelId, "hello");
 *
 * // caller thread
 * EventArgs reply = events.waitFor("on_message",
 *     args -> channelId.equals(args.get(0)), Duration.ofSeconds(30));
 * }</pre>
 */
public class EventManager implements EventDispatcher, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventManager.class);

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private final AtomicLong totalEventsDispatched = new AtomicLong(0);
    private final AtomicLong totalMatches = new AtomicLong(0);
    private final AtomicLong predicateFailures = new AtomicLong(0);

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Registers a one-shot waiter. Most callers want {@link #waitFor} instead, which also awaits
     * and removes it.
     *
     * @param eventName the event name to wait for
     * @param predicate extra condition on the arguments, or {@code null} to accept any
     * @return the registered waiter
     * @throws EventManagerClosedException if this manager has been closed
     */
    public OneShotWaiter addWaiter(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate) {
        return register(new OneShotWaiter(eventName, predicate, this));
    }

    /**
     * Registers a streaming waiter. Most callers want {@link #loopFor} instead, which wraps it in
     * an {@link EventStream} with timeout handling.
     *
     * @param eventName the event name to collect
     * @param predicate extra condition on the arguments, or {@code null} to accept any
     * @return the registered waiter
     * @throws EventManagerClosedException if this manager has been closed
     */
    public StreamingWaiter addStreamingWaiter(@Nonnull String eventName,
                                              @Nullable Predicate<EventArgs> predicate) {
        return register(new StreamingWaiter(eventName, predicate, this));
    }

    private <S extends Subscription> S register(S subscription) {
        ensureNotClosed();
        subscriptions.add(subscription);
        // close() may have swept the registry between the check and the add
        if (closed.get()) {
            subscription.unsubscribe();
            ensureNotClosed();
        }
        LOGGER.debug("Registered {}", subscription);
        return subscription;
    }

    /**
     * Removes a subscription. Safe to call any number of times, also for a subscription that
     * was already removed.
     *
     * @param subscription the subscription to remove
     * @return true if this call removed it, false if it was no longer registered
     */
    public boolean removeSubscription(@Nonnull Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        boolean removed = subscriptions.remove(subscription);
        if (removed) {
            LOGGER.debug("Deregistered {}", subscription);
            // Marks it inactive; its own call back here finds nothing left to remove.
            subscription.unsubscribe();
        }
        return removed;
    }

    @Override
    public void dispatch(@Nonnull String eventName, @Nonnull Object... args) {
        Objects.requireNonNull(args, "args");
        dispatch(eventName, EventArgs.of(args));
    }

    @Override
    public void dispatch(@Nonnull String eventName, @Nonnull EventArgs args) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(args, "args");
        if (closed.get()) {
            LOGGER.debug("Ignoring event '{}' dispatched after close", eventName);
            return;
        }

        totalEventsDispatched.incrementAndGet();
        for (Subscription subscription : subscriptions) {
            processSafely(subscription, eventName, args);
        }
    }

    private void processSafely(Subscription subscription, String eventName, EventArgs args) {
        try {
            if (subscription.process(eventName, args)) {
                totalMatches.incrementAndGet();
            }
        } catch (RuntimeException e) {
            predicateFailures.incrementAndGet();
            LOGGER.warn("{} threw exception while processing event '{}'", subscription, eventName, e);
        } catch (Error e) {
            LOGGER.error("{} threw Error while processing event '{}'", subscription, eventName, e);
            throw e;
        }
    }

    /**
     * Blocks until an event with the given name, accepted by the predicate, is dispatched.
     *
     * <p>The waiter is registered before blocking and removed on every exit path: match,
     * timeout, interrupt or close.
     *
     * @param eventName the event name to wait for
     * @param predicate extra condition on the arguments, or {@code null} to accept any
     * @param timeout the longest time to wait, {@code null} to wait indefinitely; zero only
     *                accepts an event dispatched concurrently with the call
     * @return the arguments of the first matching event
     * @throws WaitTimeoutException if the timeout elapsed first
     * @throws EventManagerClosedException if the manager is closed, before or during the wait
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws IllegalArgumentException if the timeout is negative
     */
    public EventArgs waitFor(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate,
                             @Nullable Duration timeout) throws InterruptedException {
        requireNonNegative(timeout, "timeout");

        OneShotWaiter waiter = addWaiter(eventName, predicate);
        try {
            if (!waiter.await(timeout)) {
                EventArgs late = waiter.expire();
                if (late != null) {
                    LOGGER.debug("waitFor('{}') matched as its timeout elapsed", eventName);
                    return late;
                }
                LOGGER.debug("waitFor('{}') timed out after {} ms", eventName, timeout.toMillis());
                throw new WaitTimeoutException(eventName, timeout);
            }
            EventArgs result = waiter.getResult();
            if (result == null) {
                throw new EventManagerClosedException(
                    "EventManager closed while waiting for '" + eventName + "'");
            }
            return result;
        } finally {
            waiter.unsubscribe();
        }
    }

    /**
     * Waits for an event with the given name, whatever its arguments.
     *
     * @see #waitFor(String, Predicate, Duration)
     */
    public EventArgs waitFor(@Nonnull String eventName, @Nullable Duration timeout)
            throws InterruptedException {
        return waitFor(eventName, null, timeout);
    }

    /**
     * Returns a lazy sequence of every event with the given name accepted by the predicate,
     * bounded by two independent timeouts.
     *
     * <p>Each step waits at most the smaller of {@code iterationTimeout} and what remains of
     * {@code loopTimeout}. A {@code null} bound is ignored; with both {@code null} the sequence
     * waits indefinitely for each event. Zero is a valid bound that expires immediately. See
     * {@link EventStream} for how the sequence ends.
     *
     * <p>The subscription is registered right away, so events dispatched between this call and
     * the first step are buffered.
     *
     * @param eventName the event name to collect
     * @param predicate extra condition on the arguments, or {@code null} to accept any
     * @param iterationTimeout the longest wait for any single event, or {@code null}
     * @param loopTimeout the overall budget for the whole loop, or {@code null}
     * @return the event stream; close it when done
     * @throws EventManagerClosedException if this manager has been closed
     * @throws IllegalArgumentException if a timeout is negative
     */
    public EventStream loopFor(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate,
                               @Nullable Duration iterationTimeout, @Nullable Duration loopTimeout) {
        requireNonNegative(iterationTimeout, "iterationTimeout");
        requireNonNegative(loopTimeout, "loopTimeout");

        StreamingWaiter waiter = addStreamingWaiter(eventName, predicate);
        return new EventStream(waiter, iterationTimeout, loopTimeout);
    }

    private static void requireNonNegative(Duration duration, String name) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + duration);
        }
    }

    // Metrics and debugging methods

    /**
     * @return the number of live subscriptions
     */
    public int getActiveSubscriptionCount() {
        return subscriptions.size();
    }

    /**
     * @param eventName the event name
     * @return the number of live subscriptions for that name
     */
    public int getSubscriptionCount(@Nonnull String eventName) {
        Objects.requireNonNull(eventName, "eventName");
        return (int) subscriptions.stream()
            .filter(subscription -> eventName.equals(subscription.getEventName()))
            .count();
    }

    public long getTotalEventsDispatched() {
        return totalEventsDispatched.get();
    }

    /**
     * @return how many times a subscription accepted a dispatched event
     */
    public long getTotalMatches() {
        return totalMatches.get();
    }

    /**
     * @return how many times a subscription threw while processing an event
     */
    public long getPredicateFailureCount() {
        return predicateFailures.get();
    }

    /**
     * Gets detailed metrics about the manager state.
     *
     * @return a map of metric names to their values
     */
    public Map<String, Object> getDetailedMetrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("totalEventsDispatched", getTotalEventsDispatched());
        metrics.put("totalMatches", getTotalMatches());
        metrics.put("predicateFailures", getPredicateFailureCount());
        metrics.put("activeSubscriptionCount", getActiveSubscriptionCount());

        Map<String, Integer> perEventCounts = new HashMap<>();
        for (Subscription subscription : subscriptions) {
            perEventCounts.merge(subscription.getEventName(), 1, Integer::sum);
        }
        metrics.put("subscriptionsPerEvent", perEventCounts);
        return metrics;
    }

    /**
     * Closes the manager. Blocked {@link #waitFor} calls fail with
     * {@link EventManagerClosedException}; open {@link EventStream}s deliver what they already
     * queued and then fail the same way. Later registrations are rejected and later dispatches
     * ignored.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            LOGGER.debug("EventManager already closed");
            return;
        }

        LOGGER.info("Closing EventManager - Total events dispatched: {}, Matches: {}, Active subscriptions: {}",
            getTotalEventsDispatched(), getTotalMatches(), getActiveSubscriptionCount());

        List<Subscription> removed = new ArrayList<>(subscriptions);
        for (Subscription subscription : removed) {
            if (subscription instanceof OneShotWaiter) {
                ((OneShotWaiter) subscription).cancel();
            } else if (subscription instanceof StreamingWaiter) {
                ((StreamingWaiter) subscription).close();
            }
            subscription.unsubscribe();
        }

        LOGGER.info("EventManager closed - Removed {} subscriptions", removed.size());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @throws EventManagerClosedException if the manager has been closed
     */
    protected void ensureNotClosed() {
        if (closed.get()) {
            throw new EventManagerClosedException("EventManager has been closed");
        }
    }
}
