package com.eventwait.eventmanager;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Single-fire subscription that releases one blocked caller on the first matching event.
 *
 * <p>The signal is a one-count latch: the first accepted event captures its arguments and
 * releases {@link #await(Duration)}; later matches are ignored. Created through
 * {@link EventManager#addWaiter} and normally driven by {@link EventManager#waitFor}.
 */
public final class OneShotWaiter implements Subscription {

    // Claims the result slot once the caller stopped waiting.
    private static final EventArgs EXPIRED = EventArgs.of(new Object());

    private final EventMatcher matcher;
    private final EventManager owner;
    private final CountDownLatch signal = new CountDownLatch(1);
    private final AtomicReference<EventArgs> result = new AtomicReference<>();
    private final AtomicBoolean active = new AtomicBoolean(true);

    OneShotWaiter(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate,
                  @Nonnull EventManager owner) {
        this.matcher = new EventMatcher(eventName, predicate);
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public String getEventName() {
        return matcher.getEventName();
    }

    @Override
    public boolean matches(String eventName, EventArgs args) {
        return matcher.matches(eventName, args);
    }

    /**
     * Raises the signal if the event matches. Raising an already raised signal is a no-op and
     * keeps the arguments of the first match.
     *
     * @return true if this event was the one that released the waiter
     */
    @Override
    public boolean process(String eventName, EventArgs args) {
        if (!active.get()) return false;

        if (matcher.matches(eventName, args) && result.compareAndSet(null, args)) {
            signal.countDown();
            return true;
        }
        return false;
    }

    /**
     * Blocks until the signal is raised or the timeout elapses.
     *
     * @param timeout how long to wait; {@code null} waits indefinitely, zero only checks
     * @return true if the signal was raised, false if the timeout elapsed first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean await(@Nullable Duration timeout) throws InterruptedException {
        if (timeout == null) {
            signal.await();
            return true;
        }
        return signal.await(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * @return the arguments of the first matching event, or {@code null} if none matched yet or
     *         the waiter was cancelled
     */
    @Nullable
    public EventArgs getResult() {
        EventArgs args = result.get();
        return args == EXPIRED ? null : args;
    }

    public boolean isSignalled() {
        return signal.getCount() == 0;
    }

    /**
     * Closes the result slot after the caller's timeout. A match that is still being evaluated
     * can then no longer be accepted.
     *
     * @return the arguments of a match accepted before the slot closed, or {@code null}
     */
    @Nullable
    EventArgs expire() {
        if (result.compareAndSet(null, EXPIRED)) {
            return null;
        }
        return getResult();
    }

    /**
     * Releases a blocked caller without a result.
     */
    void cancel() {
        signal.countDown();
    }

    @Override
    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            owner.removeSubscription(this);
        }
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public String toString() {
        return "OneShotWaiter{eventName='" + getEventName() + "', signalled=" + isSignalled() + '}';
    }
}
