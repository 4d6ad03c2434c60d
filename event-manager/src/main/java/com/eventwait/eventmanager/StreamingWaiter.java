package com.eventwait.eventmanager;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Subscription that buffers every matching event in arrival order for a consumer.
 *
 * <p>While open, each match is appended to an unbounded FIFO queue and wakes a consumer blocked
 * in {@link #take()} or {@link #poll(Duration)}. {@link #close()} stops the queue from growing but
 * keeps what it already holds, so a consumer can still drain it; once a closed queue is empty,
 * taking fails with an {@link EventManagerException}.
 *
 * <p>Thread-safety: the queue and the open flag are guarded by one lock. The predicate runs
 * outside the lock, on the dispatching thread.
 */
public final class StreamingWaiter implements Subscription {

    private final EventMatcher matcher;
    private final EventManager owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<EventArgs> events = new ArrayDeque<>();
    private boolean open = true;

    StreamingWaiter(@Nonnull String eventName, @Nullable Predicate<EventArgs> predicate,
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
     * Appends the arguments of a matching event and wakes the consumer. Does nothing once closed.
     *
     * @return true if the event was queued
     */
    @Override
    public boolean process(String eventName, EventArgs args) {
        if (!active.get() || !isOpen()) {
            return false;
        }
        if (!matcher.matches(eventName, args)) {
            return false;
        }

        lock.lock();
        try {
            // Closed while the predicate ran.
            if (!open) {
                return false;
            }
            events.addLast(args);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest queued event, blocking while the queue is empty and open.
     *
     * @return the next event
     * @throws EventManagerException if the waiter is closed and its queue is drained
     * @throws InterruptedException if interrupted while waiting
     */
    public EventArgs take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (events.isEmpty()) {
                if (!open) {
                    throw new StreamExhaustedException(getEventName());
                }
                notEmpty.await();
            }
            return events.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take()}, but gives up once the timeout elapses.
     *
     * @param timeout the longest time to block; {@code null} blocks like {@link #take()}
     * @return the next event, or {@code null} if the timeout elapsed with the queue still empty
     * @throws EventManagerException if the waiter is closed and its queue is drained
     * @throws InterruptedException if interrupted while waiting
     */
    @Nullable
    public EventArgs poll(@Nullable Duration timeout) throws InterruptedException {
        if (timeout == null) {
            return take();
        }
        return poll(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
    }

    @Nullable
    EventArgs poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (events.isEmpty()) {
                if (!open) {
                    throw new StreamExhaustedException(getEventName());
                }
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return events.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting new events. Already queued events stay available; blocked consumers are
     * woken so they can drain them or observe exhaustion.
     */
    public void close() {
        lock.lock();
        try {
            open = false;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return open;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of queued events not yet taken
     */
    public int pendingCount() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
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
        return "StreamingWaiter{eventName='" + getEventName() + "', pending=" + pendingCount()
            + ", open=" + isOpen() + '}';
    }
}
