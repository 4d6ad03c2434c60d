package com.eventwait.eventmanager;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy, finite sequence of matching events returned by {@link EventManager#loopFor}.
 *
 * <p>Each step blocks for the next event, bounded by the smaller of the per-iteration timeout and
 * what is left of the loop budget. The loop budget is charged with the wall-clock time of every
 * completed step, including the time the consumer spends between two steps. The sequence:
 * <ul>
 *   <li>ends normally once the loop budget has run out after an event was delivered;</li>
 *   <li>on a step timeout stops accepting events, delivers what is still queued and then fails
 *       with {@link LoopTimeoutException};</li>
 *   <li>fails with {@link EventManagerClosedException} if the manager is closed under it.</li>
 * </ul>
 *
 * <p>Like a {@link java.nio.file.DirectoryStream}, the stream may be iterated only once and
 * should be closed, ideally with try-with-resources:
 * <pre>{@code
 * try (EventStream messages = manager.loopFor("on_message", null, Duration.ofSeconds(5), null)) {
 *     for (EventArgs message : messages) {
 *         handle(message);
 *     }
 * }
 * }</pre>
 * The subscription is removed as soon as the sequence ends by any path, or when it is closed.
 * Timeouts surface from {@code hasNext()}. Instances are meant for a single consuming thread.
 */
public final class EventStream implements Iterable<EventArgs>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStream.class);

    private final StreamingWaiter waiter;
    private final Long iterationTimeoutNanos;
    private Long remainingLoopNanos;

    private final EventIterator iterator = new EventIterator();
    private boolean iteratorReturned;
    private boolean finished;

    EventStream(@Nonnull StreamingWaiter waiter, @Nullable Duration iterationTimeout,
                @Nullable Duration loopTimeout) {
        this.waiter = Objects.requireNonNull(waiter, "waiter");
        this.iterationTimeoutNanos = toNanos(iterationTimeout);
        this.remainingLoopNanos = toNanos(loopTimeout);
    }

    private static Long toNanos(Duration duration) {
        return duration == null ? null : TimeUnit.NANOSECONDS.convert(duration);
    }

    /**
     * Returns the iterator over this stream's events.
     *
     * @throws IllegalStateException if called more than once, or after the stream was closed
     */
    @Override
    public Iterator<EventArgs> iterator() {
        if (iteratorReturned) {
            throw new IllegalStateException("EventStream can only be iterated once");
        }
        if (finished) {
            throw new IllegalStateException("EventStream is closed");
        }
        iteratorReturned = true;
        return iterator;
    }

    /**
     * Exposes the events as a sequential {@link Stream}. Closing the returned stream closes this
     * event stream.
     *
     * @return a stream over the remaining events
     */
    public Stream<EventArgs> stream() {
        Spliterator<EventArgs> spliterator = Spliterators.spliteratorUnknownSize(
            iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    public String getEventName() {
        return waiter.getEventName();
    }

    /**
     * @return the number of events delivered so far
     */
    public long getDeliveredCount() {
        return iterator.delivered;
    }

    /**
     * @return false once the sequence has ended or was closed
     */
    public boolean isOpen() {
        return !finished;
    }

    /**
     * Ends the sequence and removes its subscription. Events still queued are discarded.
     * Idempotent.
     */
    @Override
    public void close() {
        iterator.next = null;
        finish();
    }

    private void finish() {
        if (finished) {
            return;
        }
        finished = true;
        waiter.close();
        waiter.unsubscribe();
        LOGGER.debug("loopFor('{}') finished after {} events", getEventName(), iterator.delivered);
    }

    private final class EventIterator implements Iterator<EventArgs> {

        private EventArgs next;
        private long delivered;
        private boolean draining;
        private boolean chargePending;
        private long stepStartNanos;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                next = advance();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finish();
                throw new EventManagerException(
                    "Interrupted while looping for '" + getEventName() + "'", e);
            } catch (RuntimeException | Error e) {
                finish();
                throw e;
            }
            return next != null;
        }

        @Override
        public EventArgs next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            EventArgs item = next;
            next = null;
            delivered++;
            return item;
        }

        private EventArgs advance() throws InterruptedException {
            if (!draining) {
                if (chargePending) {
                    chargePending = false;
                    if (remainingLoopNanos != null) {
                        remainingLoopNanos -= System.nanoTime() - stepStartNanos;
                        if (remainingLoopNanos <= 0L) {
                            LOGGER.debug("loopFor('{}') used up its loop timeout", getEventName());
                            finish();
                            return null;
                        }
                    }
                }

                stepStartNanos = System.nanoTime();
                EventArgs item;
                try {
                    Long bound = currentBoundNanos();
                    item = bound == null ? waiter.take() : waiter.poll(bound, TimeUnit.NANOSECONDS);
                } catch (StreamExhaustedException e) {
                    throw new EventManagerClosedException(
                        "EventManager closed while looping for '" + getEventName() + "'");
                }
                if (item != null) {
                    chargePending = true;
                    return item;
                }

                waiter.close();
                draining = true;
                LOGGER.debug("loopFor('{}') timed out, draining {} queued events",
                    getEventName(), waiter.pendingCount());
            }

            try {
                return waiter.take();
            } catch (StreamExhaustedException e) {
                throw new LoopTimeoutException(getEventName(), delivered);
            }
        }

        private Long currentBoundNanos() {
            if (remainingLoopNanos == null) {
                return iterationTimeoutNanos;
            }
            if (iterationTimeoutNanos == null) {
                return remainingLoopNanos;
            }
            return Math.min(remainingLoopNanos, iterationTimeoutNanos);
        }
    }
}
